package ca.gc.cra.glyphforge.domain.capsule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Primary capsule plus its size variants and edge-case derivatives, in generation order.
 *
 * <p>Closing the set closes every capsule it holds. Closing is idempotent.</p>
 *
 * @since 0.1.0
 */
public final class SymbolCapsuleSet implements AutoCloseable {
  private final SymbolCapsule primary;
  private final List<SymbolCapsule> variants;

  public SymbolCapsuleSet(SymbolCapsule primary, List<SymbolCapsule> variants) {
    this.primary = Objects.requireNonNull(primary, "primary");
    this.variants = List.copyOf(Objects.requireNonNull(variants, "variants"));
  }

  public SymbolCapsule primary() {
    return primary;
  }

  public List<SymbolCapsule> variants() {
    return variants;
  }

  /**
   * Primary followed by every variant.
   *
   * @return immutable list of all capsules in the set
   */
  public List<SymbolCapsule> all() {
    List<SymbolCapsule> all = new ArrayList<>(variants.size() + 1);
    all.add(primary);
    all.addAll(variants);
    return List.copyOf(all);
  }

  public int size() {
    return variants.size() + 1;
  }

  @Override
  public void close() {
    primary.close();
    for (SymbolCapsule variant : variants) {
      variant.close();
    }
  }
}
