import com.shapetea.util.PMap;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    /** Distinct keys sharing one hash code. */
    private static final class Clash {
        final String name;

        Clash(String name) {
            this.name = name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Clash && ((Clash) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return 42;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    @Test
    public void iteration_follows_insertion_order() {
        PMap<Integer, String> map = PMap.empty();
        for (int i = 500; i >= 0; i -= 7) {
            map = map.put(i, "v" + i);
        }
        List<Integer> expected = new ArrayList<>();
        for (int i = 500; i >= 0; i -= 7) {
            expected.add(i);
        }
        assertEquals(expected, new ArrayList<>(map.keySet()));
        assertEquals(expected.size(), map.size());
    }

    @Test
    public void replacing_a_value_keeps_its_position() {
        PMap<String, Integer> map = PMap.<String, Integer>empty().put("a", 1).put("b", 2).put("c", 3);
        PMap<String, Integer> updated = map.put("a", 10);
        assertEquals(Arrays.asList("a", "b", "c"), new ArrayList<>(updated.keySet()));
        assertEquals(10, updated.get("a"));
        assertSame(updated, updated.put("a", 10));
    }

    @Test
    public void updates_leave_earlier_versions_untouched() {
        PMap<Integer, Integer> base = PMap.empty();
        for (int i = 0; i < 2000; i++) {
            base = base.put(i, i * i);
        }
        PMap<Integer, Integer> changed = base.put(1234, -1).remove(7).put(5000, 5);

        assertEquals(2000, base.size());
        assertEquals(1234 * 1234, base.get(1234));
        assertEquals(49, base.get(7));
        assertFalse(base.containsKey(5000));

        assertEquals(2000, changed.size());
        assertEquals(-1, changed.get(1234));
        assertNull(changed.get(7));
        assertEquals(5, changed.get(5000));
    }

    @Test
    public void colliding_keys_are_kept_apart() {
        Clash x = new Clash("x");
        Clash y = new Clash("y");
        Clash z = new Clash("z");
        PMap<Clash, Integer> map = PMap.<Clash, Integer>empty().put(x, 1).put(y, 2).put(z, 3);

        assertEquals(3, map.size());
        assertEquals(2, map.get(new Clash("y")));
        assertEquals(Arrays.asList(x, y, z), new ArrayList<>(map.keySet()));

        PMap<Clash, Integer> less = map.remove(y).remove(x);
        assertEquals(1, less.size());
        assertEquals(3, less.get(z));
        assertNull(less.get(x));
        assertEquals(3, map.size());
    }

    @Test
    public void removing_every_key_empties_the_map() {
        PMap<Integer, Integer> map = PMap.empty();
        for (int i = 0; i < 100; i++) {
            map = map.put(i * 31, i);
        }
        for (int i = 0; i < 100; i++) {
            map = map.remove(i * 31);
        }
        assertTrue(map.isEmpty());
        assertEquals(PMap.empty(), map);
        assertSame(map, map.remove(3));
    }

    @Test
    public void equality_ignores_insertion_order() {
        Map<String, Integer> source = new LinkedHashMap<>();
        source.put("p", 1);
        source.put("q", 2);
        PMap<String, Integer> forward = PMap.of(source);
        PMap<String, Integer> backward = PMap.<String, Integer>empty().put("q", 2).put("p", 1);

        assertEquals(forward, backward);
        assertEquals(forward.hashCode(), backward.hashCode());
        assertNotEquals(forward, backward.put("p", 9));
        assertEquals("{p=1, q=2}", forward.toString());
    }
}
