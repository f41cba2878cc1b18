import com.shapetea.context.ShEnv;
import com.shapetea.context.ShHeap;
import com.shapetea.context.ShValue;
import com.shapetea.context.ShValue.SVAddr;
import com.shapetea.context.ShValue.SVInt;
import com.shapetea.context.ShValue.SVObject;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ShHeapEnvTest {

    @Test
    public void malloc_hands_out_increasing_addresses() {
        ShHeap heap = ShHeap.empty();
        ShHeap.Allocated a = heap.malloc(null);
        ShHeap.Allocated b = a.heap.malloc(null);
        assertEquals(0, a.addr.addr);
        assertEquals(1, b.addr.addr);
        assertEquals(1, b.heap.addrMax);
        assertNull(b.heap.getVal(b.addr));
    }

    @Test
    public void set_val_does_not_touch_the_original() {
        ShHeap.Allocated a = ShHeap.empty().allocNew(SVInt.of(1, null), null);
        ShHeap changed = a.heap.setVal(a.addr, SVInt.of(2, null));
        assertEquals(1.0, ((SVInt) a.heap.getVal(a.addr)).constValue());
        assertEquals(2.0, ((SVInt) changed.getVal(a.addr)).constValue());
    }

    @Test
    public void free_of_top_address_returns_it() {
        ShHeap.Allocated a = ShHeap.empty().allocNew(SVInt.of(1, null), null);
        ShHeap.Allocated b = a.heap.allocNew(SVInt.of(2, null), null);
        ShHeap freed = b.heap.free(b.addr);
        assertEquals(0, freed.addrMax);
        assertNull(freed.getVal(b.addr));
        assertEquals(1, freed.malloc(null).addr.addr);

        ShHeap inner = b.heap.free(a.addr);
        assertEquals(1, inner.addrMax);
    }

    @Test
    public void fetch_and_sanitize_follow_address_chains() {
        ShHeap.Allocated num = ShHeap.empty().allocNew(SVInt.of(5, null), null);
        ShHeap.Allocated ref = num.heap.allocNew(num.addr, null);
        assertEquals(5.0, ((SVInt) ref.heap.fetchAddr(ref.addr)).constValue());
        assertEquals(5.0, ((SVInt) ref.heap.sanitizeAddr(ref.addr)).constValue());

        ShHeap.Allocated slot = ref.heap.malloc(null);
        ShHeap withObj = slot.heap.setVal(slot.addr, SVObject.create(slot.addr, null));
        ShHeap.Allocated objRef = withObj.allocNew(slot.addr, null);
        ShValue sanitized = objRef.heap.sanitizeAddr(objRef.addr);
        assertTrue(sanitized instanceof SVAddr);
        assertEquals(slot.addr.addr, ((SVAddr) sanitized).addr);

        assertNull(objRef.heap.sanitizeAddr(new SVAddr(99, null)));
        SVInt plain = SVInt.of(3, null);
        assertSame(plain, objRef.heap.sanitizeAddr(plain));
    }

    @Test
    public void env_is_persistent() {
        ShEnv empty = ShEnv.empty();
        ShEnv one = empty.setId("x", new SVAddr(0, null));
        ShEnv two = one.setId("y", new SVAddr(1, null));

        assertFalse(empty.hasId("x"));
        assertEquals(0, one.getId("x").addr);
        assertNull(one.getId("y"));
        assertEquals(1, two.getId("y").addr);

        ShEnv removed = two.removeId("x");
        assertFalse(removed.hasId("x"));
        assertTrue(two.hasId("x"));
        assertSame(removed, removed.removeId("missing"));
    }

    @Test
    public void offset_shifts_only_non_negative_addresses() {
        ShEnv env = ShEnv.empty().setId("a", new SVAddr(2, null)).setId("b", new SVAddr(-3, null));
        ShEnv shifted = env.addOffset(-10);
        assertEquals(-8, shifted.getId("a").addr);
        assertEquals(-3, shifted.getId("b").addr);
    }
}
