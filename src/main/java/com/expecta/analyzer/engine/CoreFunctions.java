package com.expecta.analyzer.engine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The builtins every analyzer starts with: append, list, role, header. */
public final class CoreFunctions {

    private CoreFunctions() {}

    public static Map<String, BuiltinFunction> create() {
        Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
        install(functions);
        return functions;
    }

    public static void install(Map<String, BuiltinFunction> functions) {
        functions.put("append", args -> {
            CdForm acc = CdForm.NIL;
            for (CdForm next : args) acc = append(acc, next);
            return acc;
        });

        functions.put("list", args -> CdForm.list(args));

        functions.put("role", args -> {
            requireArgCount("role", args, 2);
            CdForm frame = args.get(0);
            CdForm name = args.get(1);
            if (name.getType() != CdForm.Type.SYMBOL) {
                throw AnalysisException.malformed("role", "role() expects a symbol role name, got " + name);
            }
            if (frame.getType() != CdForm.Type.FRAME) return CdForm.NIL;
            return frame.filler(name.asSymbol());
        });

        functions.put("header", args -> {
            requireArgCount("header", args, 1);
            CdForm frame = args.get(0);
            if (frame.getType() != CdForm.Type.FRAME) return CdForm.NIL;
            return CdForm.symbol(frame.header());
        });
    }

    /**
     * nil is the identity on either side. A frame absorbs the roles of a second
     * frame (keeping its own header); lists concatenate; a list followed by any
     * other form gains it as a last element.
     */
    static CdForm append(CdForm a, CdForm b) {
        if (a.isNil()) return b;
        if (b.isNil()) return a;

        if (a.getType() == CdForm.Type.FRAME && b.getType() == CdForm.Type.FRAME) {
            List<CdForm.Role> roles = new ArrayList<>(a.roles());
            roles.addAll(b.roles());
            return CdForm.frame(a.header(), roles);
        }

        if (a.getType() == CdForm.Type.LIST) {
            List<CdForm> items = new ArrayList<>(a.items());
            if (b.getType() == CdForm.Type.LIST) items.addAll(b.items());
            else items.add(b);
            return CdForm.list(items);
        }

        throw AnalysisException.malformed("append", "append() cannot combine " + a.getType() + " with " + b.getType());
    }

    private static void requireArgCount(String name, List<CdForm> args, int expected) {
        if (args.size() != expected) {
            throw AnalysisException.malformed(name, name + "() expects " + expected + " arguments, got " + args.size());
        }
    }
}
