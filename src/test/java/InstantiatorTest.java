import org.junit.jupiter.api.Test;

import com.expecta.analyzer.engine.AnalysisException;
import com.expecta.analyzer.engine.CdForm;
import com.expecta.analyzer.engine.Environment;
import com.expecta.analyzer.engine.ErrorKind;
import com.expecta.analyzer.engine.Instantiator;
import com.expecta.analyzer.lexicon.Parser;
import com.expecta.analyzer.lexicon.RequestCompiler;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class InstantiatorTest {

    private static CdForm template(String src) {
        return RequestCompiler.toForm(Parser.parseOne(src), "test");
    }

    private static CdForm sym(String s) {
        return CdForm.symbol(s);
    }

    @Test
    void prunesRolesWhoseFillerIsNil() {
        Environment env = new Environment();
        env.set("V1", sym("jack"));
        env.set("V2", sym("store"));
        env.set("V3", CdForm.NIL);

        CdForm out = new Instantiator().instantiate(
                template("(ptrans (actor ?V1) (object ?V1) (to ?V2) (from ?V3))"), env);

        assertEquals("(ptrans (actor jack) (object jack) (to store))", out.toString());
        assertFalse(out.containsVariables());
    }

    @Test
    void frameWithEveryRoleDroppedKeepsHeader() {
        Environment env = new Environment();
        env.set("a", CdForm.NIL);
        env.set("b", CdForm.NIL);

        CdForm out = new Instantiator().instantiate(template("(ptrans (actor ?a) (to ?b))"), env);
        assertEquals("(ptrans)", out.toString());
        assertEquals(CdForm.frame("ptrans"), out);
    }

    @Test
    void literalRoleNilIsAlsoDropped() {
        Environment env = new Environment();
        CdForm out = new Instantiator().instantiate(template("(ptrans (actor (jack)) (from nil))"), env);
        assertEquals("(ptrans (actor (jack)))", out.toString());
    }

    @Test
    void resolvesThroughSeveralLevels() {
        Environment env = new Environment();
        env.set("who", template("(person (name ?name))"));
        env.set("name", template("(jack)"));
        env.set(Environment.CONCEPT, template("(ptrans (actor ?who) (object ?who))"));

        CdForm out = new Instantiator().instantiate(env.get(Environment.CONCEPT), env);
        assertEquals("(ptrans (actor (person (name (jack)))) (object (person (name (jack)))))", out.toString());
    }

    @Test
    void sharedReferenceIsNotACycle() {
        Environment env = new Environment();
        env.set("x", template("(pair (left ?y) (right ?y))"));
        env.set("y", template("(leaf (value ?z))"));
        env.set("z", sym("one"));

        CdForm out = new Instantiator().instantiate(CdForm.variable("x"), env);
        assertEquals("(pair (left (leaf (value one))) (right (leaf (value one))))", out.toString());
    }

    @Test
    void deepDiamondChain_resolvesEachSlotOnce() {
        Environment env = new Environment();
        env.set("d0", sym("leaf"));
        for (int i = 1; i <= 40; i++) {
            env.set("d" + i, template("(node (left ?d" + (i - 1) + ") (right ?d" + (i - 1) + "))"));
        }

        CdForm out = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> new Instantiator().instantiate(CdForm.variable("d40"), env));

        CdForm node = out;
        for (int i = 40; i > 0; i--) {
            assertEquals("node", node.header());
            assertEquals(node.filler("left"), node.filler("right"));
            node = node.filler("left");
        }
        assertEquals(sym("leaf"), node);
    }

    @Test
    void directSelfReference_isCyclicBinding() {
        Environment env = new Environment();
        env.set("a", template("(loop (next ?a))"));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new Instantiator().instantiate(CdForm.variable("a"), env));
        assertEquals(ErrorKind.CYCLIC_BINDING, ex.kind());
        assertEquals("a", ex.subject());
        assertTrue(ex.getMessage().contains("a -> a"), ex.getMessage());
    }

    @Test
    void transitiveCycle_reportsChain() {
        Environment env = new Environment();
        env.set("a", CdForm.variable("b"));
        env.set("b", template("(wrap (inner ?c))"));
        env.set("c", CdForm.variable("a"));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new Instantiator().instantiate(template("(top (x ?a))"), env));
        assertEquals(ErrorKind.CYCLIC_BINDING, ex.kind());
        assertTrue(ex.getMessage().contains("a -> b -> c -> a"), ex.getMessage());
    }

    @Test
    void depthLimitStopsLongChains() {
        Environment env = new Environment();
        for (int i = 0; i < 10; i++) env.set("s" + i, CdForm.variable("s" + (i + 1)));
        env.set("s10", sym("end"));

        assertEquals(sym("end"), new Instantiator(11).instantiate(CdForm.variable("s0"), env));

        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new Instantiator(5).instantiate(CdForm.variable("s0"), env));
        assertEquals(ErrorKind.CYCLIC_BINDING, ex.kind());

        assertThrows(IllegalArgumentException.class, () -> new Instantiator(0));
    }

    @Test
    void unboundVariable_isUnboundSlot() {
        Environment env = new Environment();
        AnalysisException ex = assertThrows(AnalysisException.class,
                () -> new Instantiator().instantiate(template("(ptrans (actor ?goVar1))"), env));
        assertEquals(ErrorKind.UNBOUND_SLOT, ex.kind());
        assertEquals("goVar1", ex.subject());
    }

    @Test
    void compoundConceptInstantiatesEachTree() {
        Environment env = new Environment();
        env.set("buyer", template("(person (name (jack)))"));
        env.set("seller", CdForm.NIL);

        CdForm out = new Instantiator().instantiate(template(
                "((atrans (actor ?buyer) (to ?buyer) (from ?seller))"
                        + " (atrans (actor ?buyer) (object (money)) (to ?seller)))"), env);

        assertEquals(CdForm.Type.LIST, out.getType());
        assertEquals(2, out.items().size());
        assertEquals("(atrans (actor (person (name (jack)))) (to (person (name (jack)))))",
                out.items().get(0).toString());
        assertEquals("(atrans (actor (person (name (jack)))) (object (money)))",
                out.items().get(1).toString());
    }

    @Test
    void resultDoesNotFollowLaterSlotChanges() {
        Environment env = new Environment();
        env.set("where", template("(store)"));
        CdForm tpl = template("(ptrans (to ?where))");

        CdForm first = new Instantiator().instantiate(tpl, env);
        env.set("where", template("(park)"));

        assertEquals("(ptrans (to (store)))", first.toString());
        assertEquals("(ptrans (to (park)))", new Instantiator().instantiate(tpl, env).toString());
        assertTrue(tpl.containsVariables());
    }

    @Test
    void atomsPassThrough() {
        Environment env = new Environment();
        Instantiator inst = new Instantiator();
        assertSame(CdForm.NIL, inst.instantiate(CdForm.NIL, env));
        assertSame(CdForm.NIL, inst.instantiate(null, env));
        assertEquals(sym("store"), inst.instantiate(sym("store"), env));
        assertEquals(3.0, inst.instantiate(CdForm.number(3), env).asNumber(), 1e-9);
    }
}
