package com.pstrata.server.ai.strata;

import com.pstrata.server.ai.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GroupEnumeratorTest {

    private static StrataInfo noncompliance() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("n", "00*");
        decl.put("c", "01");
        decl.put("a", "11*");
        return StrataInfo.parse(decl);
    }

    @Test
    public void testNoncomplianceHasFourGroups() {
        GroupTable table = GroupEnumerator.enumerate(noncompliance());

        assertEquals(3, table.getStratumCount());
        assertEquals(2, table.getTreatmentCount());
        assertEquals(4, table.getGroupCount());

        // never-takers and always-takers collapse, compliers keep both arms apart
        assertEquals(table.groupOf(0, 0), table.groupOf(0, 1));
        assertNotEquals(table.groupOf(1, 0), table.groupOf(1, 1));
        assertEquals(table.groupOf(2, 0), table.groupOf(2, 1));

        assertEquals(1, table.groupOf(0, 0));
        assertEquals(2, table.groupOf(1, 0));
        assertEquals(3, table.groupOf(1, 1));
        assertEquals(4, table.groupOf(2, 0));
    }

    @Test
    public void testEnumerationIsDeterministic() {
        GroupTable first = GroupEnumerator.enumerate(noncompliance());
        GroupTable second = GroupEnumerator.enumerate(noncompliance());
        assertEquals(first, second);
        assertEquals(first.getRows(), second.getRows());
    }

    @Test
    public void testRowsAreStratumMajorAndComplete() {
        GroupTable table = GroupEnumerator.enumerate(noncompliance());
        List<GroupRow> rows = table.getRows();
        assertEquals(6, rows.size());
        int i = 0;
        for (int s = 0; s < 3; s++) {
            for (int z = 0; z < 2; z++) {
                GroupRow r = rows.get(i++);
                assertEquals(s, r.getStratumId());
                assertEquals(z, r.getTreatmentId());
            }
        }
    }

    @Test
    public void testGroupIdsAreContiguousFromOne() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("a", "0?1*");
        decl.put("b", "111*");
        decl.put("c", "012");
        GroupTable table = GroupEnumerator.enumerate(StrataInfo.parse(decl));

        Set<Integer> ids = new HashSet<>();
        for (GroupRow r : table.getRows()) {
            ids.add(r.getGroupId());
        }
        assertEquals(table.getGroupCount(), ids.size());
        for (int g = 1; g <= table.getGroupCount(); g++) {
            assertTrue(ids.contains(g), "missing group " + g);
        }
        // a: 3 distinct cells, b: 1 collapsed, c: 3 distinct
        assertEquals(7, table.getGroupCount());
    }

    @Test
    public void testWildcardAlwaysGetsFreshGroup() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("w", "??*");
        GroupTable table = GroupEnumerator.enumerate(StrataInfo.parse(decl));
        assertEquals(2, table.getGroupCount());
        assertTrue(table.row(0, 0).isWildcard());
        assertNotEquals(table.groupOf(0, 0), table.groupOf(0, 1));
    }

    @Test
    public void testCollapsingNeverCrossesStrata() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("x", "11*");
        decl.put("y", "11*");
        GroupTable table = GroupEnumerator.enumerate(StrataInfo.parse(decl));
        assertEquals(2, table.getGroupCount());
        assertEquals(0, table.stratumOfGroup(1));
        assertEquals(1, table.stratumOfGroup(2));
    }

    @Test
    public void testGroupCountBounds() {
        Map<String, String> allEr = new LinkedHashMap<>();
        allEr.put("p", "000*");
        allEr.put("q", "111*");
        assertEquals(2, GroupEnumerator.enumerate(StrataInfo.parse(allEr)).getGroupCount());

        Map<String, String> noEr = new LinkedHashMap<>();
        noEr.put("p", "000");
        noEr.put("q", "111");
        assertEquals(6, GroupEnumerator.enumerate(StrataInfo.parse(noEr)).getGroupCount());
    }

    @Test
    public void testConsistentWithSkipsWildcards() {
        Map<String, String> decl = new LinkedHashMap<>();
        decl.put("n", "00*");
        decl.put("c", "01");
        decl.put("u", "?1");
        GroupTable table = GroupEnumerator.enumerate(StrataInfo.parse(decl));

        List<GroupRow> z0d0 = table.consistentWith(0, 0);
        assertEquals(2, z0d0.size());
        List<GroupRow> z1d1 = table.consistentWith(1, 1);
        assertEquals(2, z1d1.size());
        assertTrue(table.consistentWith(0, 1).isEmpty());
    }

    @Test
    public void testTreatmentLevelMismatchIsRejected() {
        TreatmentCoding threeLevels = TreatmentCoding.fromObserved(List.of("a", "b", "c"), 2);
        assertThrows(ConfigurationException.class,
                () -> GroupEnumerator.enumerate(noncompliance(), threeLevels));

        TreatmentCoding twoLevels = TreatmentCoding.fromObserved(List.of("0", "1", "1"), 2);
        assertEquals(4, GroupEnumerator.enumerate(noncompliance(), twoLevels).getGroupCount());
    }

    @Test
    public void testStratumOfGroupOutOfRange() {
        GroupTable table = GroupEnumerator.enumerate(noncompliance());
        assertThrows(IllegalArgumentException.class, () -> table.stratumOfGroup(0));
        assertThrows(IllegalArgumentException.class, () -> table.stratumOfGroup(5));
    }
}
