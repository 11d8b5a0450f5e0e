package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lookup of generators by glyph family.
 *
 * <p>Built once by the composition root and read concurrently afterwards. Registering two generators for the
 * same kind is a wiring error.</p>
 *
 * @since 0.1.0
 */
public final class GeneratorRegistry {
  private final Map<SymbolKind, SymbolGenerator> generators;

  public GeneratorRegistry(Collection<? extends SymbolGenerator> generators) {
    Objects.requireNonNull(generators, "generators");
    Map<SymbolKind, SymbolGenerator> byKind = new EnumMap<>(SymbolKind.class);
    for (SymbolGenerator generator : generators) {
      SymbolKind kind = Objects.requireNonNull(generator, "generator").kind();
      SymbolGenerator previous = byKind.putIfAbsent(kind, generator);
      if (previous != null) {
        throw new IllegalArgumentException("duplicate generator for " + kind + ": "
            + previous.getClass().getName() + " and " + generator.getClass().getName());
      }
    }
    this.generators = Collections.unmodifiableMap(byKind);
  }

  public Optional<SymbolGenerator> find(SymbolKind kind) {
    return Optional.ofNullable(generators.get(kind));
  }

  public Set<SymbolKind> kinds() {
    return generators.keySet();
  }
}
