package software.amazon.fsa;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TransitionMapConfigurationTest {

    @Test
    public void testDefault() {
        assertFalse(TransitionMapConfiguration.builder().build().isImplicitSentinelLoops());
    }

    @Test
    public void testImplicitSentinelLoops() {
        TransitionMapConfiguration configuration = TransitionMapConfiguration.builder()
                .withImplicitSentinelLoops(true)
                .build();
        assertTrue(configuration.isImplicitSentinelLoops());
        assertEquals("TransitionMapConfiguration{implicitSentinelLoops=true}", configuration.toString());
    }
}
