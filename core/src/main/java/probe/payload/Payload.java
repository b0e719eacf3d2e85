package probe.payload;

import java.util.Objects;

/**
 * A crafted input string tagged with the vulnerability class it targets.
 */
public record Payload(PayloadCategory category, String value) {

    public Payload {
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String toString() {
        return category.getKey() + ":" + value;
    }
}
