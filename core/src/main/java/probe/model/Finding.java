package probe.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single heuristic observation derived from a response.
 * Disclosure findings carry the raw header value as detail.
 */
public final class Finding {
    private final FindingType type;
    private final String detail;

    private Finding(FindingType type, String detail) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.detail = detail;
    }

    public static Finding of(FindingType type) {
        return new Finding(type, null);
    }

    public static Finding of(FindingType type, String detail) {
        return new Finding(type, detail);
    }

    public FindingType getType() {
        return type;
    }

    public String getLabel() {
        return type.getLabel();
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Finding)) {
            return false;
        }
        Finding other = (Finding) o;
        return type == other.type && Objects.equals(detail, other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, detail);
    }

    @Override
    public String toString() {
        return detail != null ? type.getLabel() + " (" + detail + ")" : type.getLabel();
    }
}
