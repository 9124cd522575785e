import com.pascals.compiler.PascalsFrontend;
import com.pascals.debug.Debug;
import org.junit.jupiter.api.Test;

import java.net.URL;
import java.net.URLClassLoader;

import static org.junit.jupiter.api.Assertions.*;

public class PascalsDebugTest {

    @Test
    void hub_has_a_sink_before_any_is_installed() throws Exception {
        // fresh loader so no other test has touched this copy of the hub
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader fresh = new URLClassLoader(new URL[] {classes}, ClassLoader.getPlatformClassLoader())) {
            Class<?> debug = Class.forName("com.pascals.debug.Debug", true, fresh);
            assertNotSame(Debug.class, debug);
            Object hub = debug.getMethod("get").invoke(null);
            assertNotNull(debug.getMethod("getSink").invoke(hub));
        }
    }

    @Test
    void default_pipeline_runs_without_a_sink() {
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> new PascalsFrontend().tokenize("x := -5"));
        assertDoesNotThrow(() -> new PascalsFrontend().analyze("program p; mulai selesai."));
    }
}
