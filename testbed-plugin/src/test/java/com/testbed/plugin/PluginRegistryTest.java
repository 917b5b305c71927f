package com.testbed.plugin;

import com.testbed.config.StepData;
import com.testbed.config.TestbedConfig;
import com.testbed.errors.SpecificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRegistryTest {

    private static final StepContext STEP = new StepContext() {
        @Override
        public String getName() {
            return "report";
        }

        @Override
        public Path getWorkdir() {
            return Path.of("/tmp/plan/report");
        }

        @Override
        public String getPlanName() {
            return "/plans/default";
        }

        @Override
        public TestbedConfig getConfig() {
            return TestbedConfig.builder().build();
        }
    };

    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
    }

    @Test
    void resolve_prefersExactMatch() {
        PluginProvider display = provider("report", "display", 50);
        PluginProvider displayAll = provider("report", "display-all", 10);
        registry.register(display);
        registry.register(displayAll);

        assertSame(display, registry.resolve("report", "display"));
    }

    @Test
    void resolve_prefixPicksLowestOrder() {
        registry.register(provider("report", "html", 50));
        registry.register(provider("report", "html-extended", 70));
        registry.register(provider("report", "junit", 50));
        PluginProvider first = provider("report", "htmlx", 20);
        registry.register(first);

        assertSame(first, registry.resolve("report", "ht"));
    }

    @Test
    void resolve_unknownMethodIsSpecificationError() {
        registry.register(provider("report", "display", 50));

        SpecificationException e = assertThrows(SpecificationException.class,
                () -> registry.resolve("report", "polarion"));
        assertTrue(e.getMessage().contains("polarion"));
        assertTrue(e.getMessage().contains("display"));
    }

    @Test
    void resolve_missingHowIsSpecificationError() {
        assertThrows(SpecificationException.class, () -> registry.resolve("report", " "));
    }

    @Test
    void register_duplicateMethodRejected() {
        registry.register(provider("report", "display", 50));

        assertThrows(IllegalArgumentException.class, () -> registry.register(provider("report", "display", 10)));
    }

    @Test
    void delegate_createsPluginWithCanonicalHow() {
        registry.register(provider("report", "display", 50));

        SamplePlugin plugin = registry.delegate(STEP, StepData.of("disp", Map.of("verbose", true)), SamplePlugin.class);

        assertEquals("display", plugin.getHow());
        assertTrue(plugin.getBoolean("verbose", false));
        assertSame(STEP, plugin.getStep());
    }

    @Test
    void delegate_wrongPluginTypeIsSpecificationError() {
        registry.register(provider("report", "display", 50));

        assertThrows(SpecificationException.class,
                () -> registry.delegate(STEP, StepData.of("display"), OtherPlugin.class));
    }

    @Test
    void getMethods_sortedByOrderThenName() {
        registry.register(provider("report", "junit", 50));
        registry.register(provider("report", "display", 50));
        registry.register(provider("report", "html", 10));

        List<String> names = registry.getMethods("report").stream().map(Method::name).toList();

        assertEquals(List.of("html", "display", "junit"), names);
        assertEquals(List.of(), registry.getMethods("execute"));
    }

    private static PluginProvider provider(String step, String method, int order) {
        return new PluginProvider() {
            @Override
            public String getStepName() {
                return step;
            }

            @Override
            public String getMethodName() {
                return method;
            }

            @Override
            public String getDescription() {
                return "Sample " + method;
            }

            @Override
            public int getOrder() {
                return order;
            }

            @Override
            public Plugin<?> createPlugin(StepContext stepContext, StepData data) {
                return new SamplePlugin(stepContext, data);
            }
        };
    }

    static final class SamplePlugin extends Plugin<StepContext> {
        SamplePlugin(StepContext step, StepData data) {
            super(step, data);
        }
    }

    static final class OtherPlugin extends Plugin<StepContext> {
        OtherPlugin(StepContext step, StepData data) {
            super(step, data);
        }
    }
}
