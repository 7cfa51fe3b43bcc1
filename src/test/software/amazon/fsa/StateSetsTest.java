package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class StateSetsTest {

    @Test
    public void testSetsAreSortedAndCompareByValue() {
        IntSortedSet set = StateSets.of(5, 1, 3);
        assertEquals(1, set.firstInt());
        assertEquals(5, set.lastInt());
        assertEquals(StateSets.of(1, 3, 5), set);
        assertEquals(StateSets.of(1, 3, 5).hashCode(), set.hashCode());
    }

    @Test
    public void testUnion() {
        IntSortedSet addTo = StateSets.of(1, 2);
        assertTrue(StateSets.union(StateSets.of(2, 3), addTo));
        assertEquals(StateSets.of(1, 2, 3), addTo);
        assertFalse(StateSets.union(StateSets.of(1, 3), addTo));
    }

    @Test
    public void testCopyIsIndependent() {
        IntSortedSet original = StateSets.of(1);
        IntSortedSet copy = StateSets.copyOf(original);
        copy.add(2);
        assertThat(original, is(equalTo(StateSets.of(1))));
        assertThat(copy, is(equalTo(StateSets.of(1, 2))));
    }
}
