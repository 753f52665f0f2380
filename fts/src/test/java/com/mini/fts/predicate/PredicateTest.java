package com.mini.fts.predicate;

import com.mini.fts.schema.DataType;
import com.mini.fts.schema.Field;
import com.mini.fts.schema.Row;
import com.mini.fts.schema.Schema;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Predicate测试
 */
public class PredicateTest {
    
    private final Schema schema = new Schema(Arrays.asList(
        new Field("id", DataType.LONG, false),
        new Field("title", DataType.STRING, true)
    ), "id");
    
    @Test
    public void testCompare() {
        Row row = new Row(10L, "Dairy Cow");
        assertTrue(Predicate.equal("id", 10L).test(row, schema));
        assertTrue(Predicate.equal("id", 10).test(row, schema));
        assertFalse(Predicate.notEqual("id", 10L).test(row, schema));
        assertTrue(Predicate.greaterThan("id", 9L).test(row, schema));
        assertFalse(Predicate.lessThan("id", 10L).test(row, schema));
        assertTrue(Predicate.lessOrEqual("id", 10L).test(row, schema));
        assertTrue(Predicate.greaterOrEqual("title", "Dairy").test(row, schema));
    }
    
    @Test
    public void testIn() {
        Predicate in = Predicate.in("id", 7, 42L);
        assertTrue(in.test(new Row(7L, null), schema));
        assertTrue(in.test(new Row(42L, null), schema));
        assertFalse(in.test(new Row(8L, null), schema));
    }
    
    @Test
    public void testLikeAndIlike() {
        Row row = new Row(1L, "A Dairy Cow");
        assertFalse(Predicate.like("title", "%dairy cow%").test(row, schema));
        assertTrue(Predicate.ilike("title", "%dairy cow%").test(row, schema));
        assertTrue(Predicate.ilike("title", "%DAIRY COW%").test(row, schema));
        assertTrue(Predicate.notLike("title", "%dairy cow%").test(row, schema));
        
        // null 不匹配任何 LIKE
        Row nullTitle = new Row(2L, null);
        assertFalse(Predicate.like("title", "%").test(nullTitle, schema));
        assertFalse(Predicate.notLike("title", "%x%").test(nullTitle, schema));
    }
    
    @Test
    public void testFoldCase() {
        assertEquals("straße", Predicate.LikePredicate.foldCase("STRAßE"));
        assertEquals("dairy-cow 42", Predicate.LikePredicate.foldCase("Dairy-COW 42"));
    }
    
    @Test
    public void testConjuncts() {
        Predicate a = Predicate.like("title", "%a%");
        Predicate b = Predicate.equal("id", 1L);
        Predicate c = Predicate.greaterThan("id", 0L);
        
        List<Predicate> conjuncts = a.and(b).and(c).conjuncts();
        assertEquals(Arrays.asList(a, b, c), conjuncts);
        
        Predicate or = a.or(b);
        assertEquals(1, or.conjuncts().size());
        assertSame(or, or.conjuncts().get(0));
    }
    
    @Test
    public void testUnknownField() {
        assertThrows(IllegalArgumentException.class, 
            () -> Predicate.equal("missing", 1L).test(new Row(1L, "x"), schema));
    }
}
