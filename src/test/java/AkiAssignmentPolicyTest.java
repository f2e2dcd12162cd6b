import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.aki.script.AkiScript;
import com.aki.script.AkiScript.AssignmentPolicy;
import com.aki.script.AkiSession;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.Value;

public class AkiAssignmentPolicyTest {

    private static AkiSession session(AssignmentPolicy policy) {
        AkiScript es = new AkiScript();
        es.setAssignmentPolicy(policy);
        return es.newSession();
    }

    @Test
    void defaultPolicy_isDefineLocal() {
        assertEquals(AssignmentPolicy.DEFINE_LOCAL, new AkiScript().getAssignmentPolicy());
    }

    @Test
    void sameScopeRedeclaration_shadows_underBothPolicies() {
        for (AssignmentPolicy policy : AssignmentPolicy.values()) {
            AkiSession s = session(policy);
            assertEquals(Value.integer(2), s.eval("let x = 1; let x = 2; x"), policy.name());
            assertEquals(Value.string("now a string"), s.eval("let x = \"now a string\"; x"), policy.name());
        }
    }

    @Test
    void innerAssignment_neverLeaksToCaller_underBothPolicies() {
        for (AssignmentPolicy policy : AssignmentPolicy.values()) {
            AkiSession s = session(policy);
            s.eval("let x = 1; func set() -> i32 { x = 5; x }");
            assertEquals(Value.integer(5), s.eval("set()"), policy.name());
            assertEquals(Value.integer(1), s.eval("x"), policy.name());
        }
    }

    @Test
    void defineLocal_eachCallStartsFromCapturedValue() {
        AkiSession s = session(AssignmentPolicy.DEFINE_LOCAL);
        s.eval("let x = 1; func bump() -> i32 { x += 1; x }");
        assertEquals(Value.integer(2), s.eval("bump()"));
        assertEquals(Value.integer(2), s.eval("bump()"));
        assertEquals(Value.integer(1), s.eval("x"));
    }

    @Test
    void mutateEnclosing_persistsInsideClosure() {
        AkiSession s = session(AssignmentPolicy.MUTATE_ENCLOSING);
        s.eval("let x = 1; func bump() -> i32 { x += 1; x }");
        assertEquals(Value.integer(2), s.eval("bump()"));
        assertEquals(Value.integer(3), s.eval("bump()"));
        // the closure owns a copy; the global is untouched
        assertEquals(Value.integer(1), s.eval("x"));
    }

    @Test
    void mutateEnclosing_unboundNameIsDefinedLocally() {
        AkiSession s = session(AssignmentPolicy.MUTATE_ENCLOSING);
        assertEquals(Value.integer(3), s.eval("func f() -> i32 { y = 3; y } f()"));
        AkiRuntimeException ex = assertThrows(AkiRuntimeException.class, () -> s.eval("y"));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, ex.getKind());
    }

    @Test
    void parameterShadowsCapturedName_underBothPolicies() {
        for (AssignmentPolicy policy : AssignmentPolicy.values()) {
            AkiSession s = session(policy);
            s.eval("let n = 100; func twice(n: i32) -> i32 { n += n; n }");
            assertEquals(Value.integer(8), s.eval("twice(4)"), policy.name());
            assertEquals(Value.integer(100), s.eval("n"), policy.name());
        }
    }

    @Test
    void topLevelAssignment_updatesGlobal_underBothPolicies() {
        for (AssignmentPolicy policy : AssignmentPolicy.values()) {
            AkiSession s = session(policy);
            assertEquals(Value.integer(6), s.eval("let total = 1; total = total + 5; total"), policy.name());
        }
    }
}
