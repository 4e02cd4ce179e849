package org.example.storyteller.service.backend;

import org.example.storyteller.service.extract.ElementExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.example.storyteller.service.llm.LlmProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class NarrationBackendRegistryTest {

    @Mock
    private LlmProvider provider;

    private NarrationBackendRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new NarrationBackendRegistry(List.of(
                new RemoteNarrationBackend(provider, 3000),
                new LocalNarrationBackend(provider, 2500),
                new TemplateNarrationBackend(new ElementExtractor(5), 2000)
        ), List.of("remote", "local", "offline"));
    }

    @Test
    void resolve_emptyPreference_usesDefaultOrder() {
        List<String> names = registry.resolve(List.of()).stream().map(NarrationBackend::name).toList();

        assertEquals(List.of("remote", "local", "offline"), names);
        assertEquals(names, registry.resolve(null).stream().map(NarrationBackend::name).toList());
    }

    @Test
    void resolve_customPreference_keepsCallerOrderIgnoringCase() {
        List<String> names = registry.resolve(List.of("Offline", " local")).stream().map(NarrationBackend::name).toList();

        assertEquals(List.of("offline", "local"), names);
    }

    @Test
    void resolve_unknownOrRepeatedName_throws() {
        assertThrows(IllegalArgumentException.class, () -> registry.resolve(List.of("cloud")));
        assertThrows(IllegalArgumentException.class, () -> registry.resolve(List.of("local", "LOCAL")));
    }

    @Test
    void constructor_duplicateBackendOrUnknownDefault_throws() {
        TemplateNarrationBackend offline = new TemplateNarrationBackend(new ElementExtractor(5), 2000);

        assertThrows(IllegalArgumentException.class,
                () -> new NarrationBackendRegistry(List.of(offline, offline), List.of("offline")));
        assertThrows(IllegalArgumentException.class,
                () -> new NarrationBackendRegistry(List.of(offline), List.of("remote")));
    }

    @Test
    void find_returnsBackendByName() {
        assertTrue(registry.find("local").isPresent());
        assertTrue(registry.find("nope").isEmpty());
        assertEquals(3, registry.getBackends().size());
    }
}
