package com.expecta.analyzer.engine;

import java.util.List;

/** Functional interface for host-registered functions callable from request expressions. */
public interface BuiltinFunction {
    CdForm call(List<CdForm> args);
}
