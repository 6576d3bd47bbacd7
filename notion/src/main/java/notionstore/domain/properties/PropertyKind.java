package notionstore.domain.properties;

import java.util.Arrays;

/**
 * The property types we know how to normalize. Anything else maps to UNKNOWN.
 */
public enum PropertyKind {
    TITLE("title"),
    RICH_TEXT("rich_text"),
    SELECT("select"),
    STATUS("status"),
    MULTI_SELECT("multi_select"),
    CHECKBOX("checkbox"),
    NUMBER("number"),
    URL("url"),
    EMAIL("email"),
    PHONE_NUMBER("phone_number"),
    DATE("date"),
    CREATED_TIME("created_time"),
    LAST_EDITED_TIME("last_edited_time"),
    PEOPLE("people"),
    UNKNOWN("");

    private final String type;

    PropertyKind(final String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }

    public static PropertyKind fromType(final String type) {
        return Arrays.stream(values())
                .filter(kind -> kind != UNKNOWN)
                .filter(kind -> kind.type.equals(type))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
