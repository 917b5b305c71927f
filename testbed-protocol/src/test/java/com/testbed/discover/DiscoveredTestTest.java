package com.testbed.discover;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class DiscoveredTestTest {

    @Test
    void metadata_includesFieldsAndKeepsExtraKeys() {
        DiscoveredTest test = DiscoveredTest.builder("/tests/smoke")
                .test("./run.sh")
                .framework("beakerlib")
                .duration("10m")
                .environment(Map.of("FOO", "bar"))
                .metadata(Map.of("summary", "Smoke test"))
                .build();

        Map<String, Object> md = test.getMetadata();

        assertEquals("/tests/smoke", md.get("name"));
        assertEquals("./run.sh", md.get("test"));
        assertEquals("beakerlib", md.get("framework"));
        assertEquals("10m", md.get("duration"));
        assertEquals("respect", md.get("result"));
        assertEquals("Smoke test", md.get("summary"));
        assertEquals(Map.of("FOO", "bar"), md.get("environment"));
    }

    @Test
    void executionFields_areUnsetUntilRun() {
        DiscoveredTest test = DiscoveredTest.builder("/t").build();

        assertNull(test.getReturncode());
        assertNull(test.getRealDuration());

        test.setReturncode(1);
        test.setRealDuration("00:00:03");

        assertEquals(1, test.getReturncode());
        assertEquals("00:00:03", test.getRealDuration());
    }
}
