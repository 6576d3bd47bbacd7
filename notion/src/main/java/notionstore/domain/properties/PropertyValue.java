package notionstore.domain.properties;

import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.Preconditions;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A normalized page property value. Each variant serializes to JSON as its bare value, and renders to
 * text through {@link #asText()}.
 */
public sealed interface PropertyValue permits PropertyValue.Text, PropertyValue.Number, PropertyValue.Bool,
        PropertyValue.TextList, PropertyValue.Timestamp {

    /**
     * The single text form of the value used by frontmatter.
     */
    String asText();

    record Text(String value) implements PropertyValue {
        public Text {
            Preconditions.checkNotNull(value);
        }

        @JsonValue
        public String toJson() {
            return value;
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Number(double value) implements PropertyValue {
        public Number {
            Preconditions.checkArgument(Double.isFinite(value), "Numbers must be finite");
        }

        @JsonValue
        public double toJson() {
            return value;
        }

        /**
         * The shortest decimal form that round trips, without an exponent or a trailing ".0".
         */
        @Override
        public String asText() {
            if (value == 0 && Double.doubleToRawLongBits(value) != 0) {
                return "-0";
            }

            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }
    }

    record Bool(boolean value) implements PropertyValue {
        @JsonValue
        public boolean toJson() {
            return value;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }

    record TextList(List<String> values) implements PropertyValue {
        public TextList {
            values = List.copyOf(values);
        }

        @JsonValue
        public List<String> toJson() {
            return values;
        }

        @Override
        public String asText() {
            return String.join(", ", values);
        }
    }

    record Timestamp(Instant value) implements PropertyValue {
        public Timestamp {
            Preconditions.checkNotNull(value);
        }

        /**
         * RFC 3339 in UTC, e.g. 2024-01-31T00:00:00Z.
         */
        @JsonValue
        @Override
        public String asText() {
            return value.toString();
        }
    }
}
