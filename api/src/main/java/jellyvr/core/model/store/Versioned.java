package jellyvr.core.model.store;

/**
 * A decoded record together with the exact stored text it was decoded from.
 * The raw text is what a compare-and-swap must be conditioned on.
 *
 * @param value decoded record
 * @param raw stored representation
 */
public record Versioned<T>(T value, String raw) {}
