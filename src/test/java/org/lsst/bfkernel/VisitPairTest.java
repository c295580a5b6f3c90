package org.lsst.bfkernel;

import java.util.Arrays;
import java.util.List;
import static org.junit.Assert.assertEquals;
import org.junit.Test;

public class VisitPairTest {

    @Test
    public void testParse() {
        List<VisitPair> pairs = VisitPair.parseList("(123,124), ( 125 , 126 )");
        assertEquals(Arrays.asList(new VisitPair(123, 124), new VisitPair(125, 126)), pairs);
        assertEquals("(123,124)", pairs.get(0).toString());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalid() {
        VisitPair.parseList("(123,124),(125)");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmpty() {
        VisitPair.parseList("");
    }

    @Test
    public void testDescribe() {
        assertEquals("1234-6, 1240", VisitPair.describe(Arrays.asList(1236, 1234, 1240, 1235)));
        assertEquals("9-10", VisitPair.describe(Arrays.asList(9, 10)));
        assertEquals("7", VisitPair.describe(Arrays.asList(7, 7)));
        assertEquals("", VisitPair.describe(Arrays.<Integer>asList()));
    }
}
