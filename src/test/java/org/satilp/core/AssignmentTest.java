package org.satilp.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentTest {

    @Test
    @DisplayName("获取存在的变量值")
    void testGetValue() {
        Assignment assignment = Assignment.of(Map.of("a", true, "b", false));
        assertTrue(assignment.getValue("a"));
        assertFalse(assignment.getValue("b"));
        assertEquals(2, assignment.size());
    }

    @Test
    @DisplayName("获取不存在的变量值应抛出 UnboundVariableException")
    void testGetValue_Unbound_ShouldThrow() {
        Assignment assignment = Assignment.of(Map.of("a", true));
        UnboundVariableException e = assertThrows(UnboundVariableException.class, () -> assignment.getValue("z"));
        assertEquals("z", e.getVariableName());
        assertFalse(assignment.isBound("z"));
    }

    @Test
    @DisplayName("with 返回新的赋值，原赋值不变")
    void testWith() {
        Assignment original = Assignment.empty().with("a", true);
        Assignment updated = original.with("a", false).with("b", true);

        assertTrue(original.getValue("a"));
        assertFalse(updated.getValue("a"));
        assertTrue(updated.getValue("b"));
        assertEquals(1, original.size());
    }

    @Test
    @DisplayName("null 值应被拒绝")
    void testNullValue_ShouldThrow() {
        Map<String, Boolean> values = new HashMap<>();
        values.put("a", null);
        assertThrows(NullPointerException.class, () -> Assignment.of(values));
    }

    @Test
    @DisplayName("equals 与 toString")
    void testEqualsAndToString() {
        Assignment a1 = Assignment.of(Map.of("b", false, "a", true));
        Assignment a2 = Assignment.empty().with("a", true).with("b", false);
        assertEquals(a1, a2);
        assertEquals(a1.hashCode(), a2.hashCode());
        assertEquals("{a=true, b=false}", a1.toString());
    }
}
