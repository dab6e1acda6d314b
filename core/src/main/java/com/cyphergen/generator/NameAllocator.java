package com.cyphergen.generator;

import com.cyphergen.exception.NameCollisionException;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Hands out identifiers for variables and parameters within one build.
 *
 * <p>Explicit names are returned verbatim; the prefix only applies to generated
 * names, so that a named reference stays stable across differently prefixed
 * builds. Generated names follow {@code {prefix}{tag}{counter}}, one counter per
 * identifier class. The counter never goes back, and a candidate already owned
 * by an explicit name is skipped.
 *
 * <p>The allocator does not memoize: {@link CypherEnvironment} calls it once per
 * identity. It only remembers which identity owns which name, to reject
 * collisions.
 */
final class NameAllocator {

    /**
     * Identifier classes. Variables and parameters live in separate namespaces
     * since parameters always render with a {@code $} sigil.
     */
    enum IdentifierClass {
        VARIABLE(NamingConfig.VARIABLE_TAG),
        PARAMETER(NamingConfig.PARAMETER_TAG);

        private final String tag;

        IdentifierClass(String tag) {
            this.tag = tag;
        }

        String tag() {
            return tag;
        }
    }

    private final String prefix;
    private final Map<IdentifierClass, Integer> counters = new EnumMap<>(IdentifierClass.class);
    private final Map<IdentifierClass, Map<String, Object>> owners = new EnumMap<>(IdentifierClass.class);

    NameAllocator(String prefix) {
        this.prefix = NamingConfig.normalizePrefix(prefix);
        for (IdentifierClass cls : IdentifierClass.values()) {
            counters.put(cls, 0);
            owners.put(cls, new HashMap<>());
        }
    }

    String prefix() {
        return prefix;
    }

    /**
     * Allocates a name for an identity.
     *
     * @param cls the identifier class
     * @param identity the object the name is for
     * @param explicitName the caller-supplied name, or null for a generated one
     * @return the allocated name
     * @throws NameCollisionException if the explicit name is owned by another identity
     */
    String allocate(IdentifierClass cls, Object identity, String explicitName) {
        Objects.requireNonNull(identity, "identity must not be null");
        Map<String, Object> taken = owners.get(cls);

        if (explicitName != null) {
            Object owner = taken.get(explicitName);
            if (owner != null && owner != identity) {
                throw new NameCollisionException(explicitName,
                    "Explicit " + cls.name().toLowerCase() + " name already bound to a different identity");
            }
            taken.put(explicitName, identity);
            return explicitName;
        }

        String candidate;
        do {
            int next = counters.get(cls);
            counters.put(cls, next + 1);
            candidate = prefix + cls.tag() + next;
        } while (taken.containsKey(candidate));

        taken.put(candidate, identity);
        return candidate;
    }

    /**
     * Returns whether a name of the given class has been handed out.
     */
    boolean isTaken(IdentifierClass cls, String name) {
        return owners.get(cls).containsKey(name);
    }
}
