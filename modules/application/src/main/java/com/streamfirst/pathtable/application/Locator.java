package com.streamfirst.pathtable.application;

import com.streamfirst.pathtable.domain.KeyBinding;
import com.streamfirst.pathtable.domain.LocatedPath;
import com.streamfirst.pathtable.domain.PathTemplate;
import com.streamfirst.pathtable.ports.StoragePort;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * Finds the files of one templated file set on a storage provider and maps between
 * paths and key bindings.
 */
@Slf4j
@RequiredArgsConstructor
public class Locator {

    @NonNull
    private final PathTemplate template;
    @NonNull
    private final StoragePort storagePort;

    public PathTemplate template() {
        return template;
    }

    /**
     * Renders the concrete path of a full binding without touching storage.
     */
    public String buildPath(KeyBinding binding) {
        return template.build(binding);
    }

    /**
     * Extracts the binding of a path, if the path conforms to the template.
     */
    public Optional<KeyBinding> parse(String path) {
        return template.match(path);
    }

    /**
     * Lists the paths conforming to the template whose placeholder values agree with
     * {@code constraints}. Constraint names that are not placeholders are ignored.
     * The returned stream is lazy and must be closed.
     */
    public Stream<String> findPaths(KeyBinding constraints) {
        return findPathsAndBindings(constraints).map(LocatedPath::path);
    }

    /**
     * Like {@link #findPaths(KeyBinding)}, pairing each path with its extracted binding.
     */
    public Stream<LocatedPath> findPathsAndBindings(KeyBinding constraints) {
        KeyBinding keyConstraints = normalize(constraints);
        String prefix = template.listingPrefix(keyConstraints);
        log.debug("Listing '{}' for template {} with constraints {}", prefix, template, keyConstraints);

        return storagePort.list(prefix)
            .flatMap(path -> template.match(path)
                .filter(binding -> binding.agreesWith(keyConstraints))
                .map(binding -> new LocatedPath(path, binding))
                .stream());
    }

    public boolean exists(KeyBinding binding) {
        return storagePort.exists(buildPath(binding));
    }

    private KeyBinding normalize(KeyBinding constraints) {
        KeyBinding.Builder normalized = KeyBinding.builder();
        for (String name : constraints.names()) {
            if (template.placeholder(name).isPresent()) {
                normalized.put(name, template.checkValue(name, constraints.get(name)));
            }
        }
        return normalized.build();
    }
}
