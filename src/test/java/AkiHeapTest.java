import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.aki.script.AkiScript;
import com.aki.script.parser.AkiRuntimeException;
import com.aki.script.parser.ErrorKind;
import com.aki.script.parser.Heap;
import com.aki.script.parser.Value;

public class AkiHeapTest {

    @Test
    void allocateAndLoad() {
        Heap heap = new Heap();
        int a = heap.allocate(Value.integer(1));
        int b = heap.allocate(Value.string("two"));
        assertEquals(0, a);
        assertEquals(1, b);
        assertEquals(Value.string("two"), heap.load(b));
        assertEquals(2, heap.size());
    }

    @Test
    void unknownAddress_isInvalidReference() {
        Heap heap = new Heap();
        heap.allocate(Value.unit());
        AkiRuntimeException ex = assertThrows(AkiRuntimeException.class, () -> heap.load(1));
        assertEquals(ErrorKind.INVALID_REFERENCE, ex.getKind());
        assertThrows(AkiRuntimeException.class, () -> heap.load(-1));
    }

    @Test
    void allocDerefIntrinsics() {
        AkiScript es = new AkiScript();
        assertEquals(Value.integer(5), es.run("let r = alloc(5); deref(r)"));
        assertEquals("&1", es.run("alloc(1); alloc(2)").toString());

        Value v = es.run("let r = alloc([1, 2]); let s = r; deref(s)[1]");
        assertEquals(Value.integer(2), v);
    }

    @Test
    void intrinsicErrors() {
        AkiScript es = new AkiScript();
        AkiRuntimeException notRef = assertThrows(AkiRuntimeException.class, () -> es.run("deref(3)"));
        assertEquals(ErrorKind.TYPE_MISMATCH, notRef.getKind());

        AkiRuntimeException arity = assertThrows(AkiRuntimeException.class, () -> es.run("alloc(1, 2)"));
        assertEquals(ErrorKind.ARITY_MISMATCH, arity.getKind());
    }

    @Test
    void userFunctionShadowsIntrinsic() {
        assertEquals(Value.integer(-1), new AkiScript().run("func alloc(v: dyn) -> i32 { -1 } alloc(3)"));
    }
}
