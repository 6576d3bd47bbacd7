package notionstore.domain.properties;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import notionstore.domain.date.DateParser;
import notionstore.infrastructure.notion.api.NotionDate;
import notionstore.infrastructure.notion.api.NotionProperty;
import notionstore.infrastructure.notion.api.NotionRichText;
import notionstore.infrastructure.notion.api.NotionSelectOption;
import notionstore.infrastructure.notion.api.NotionUser;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Normalizes Notion page properties. Unknown property types are dropped so new types added to the API
 * do not break reads.
 */
@ApplicationScoped
public class NotionPropertyNormalizer implements PropertyNormalizer {

    @Inject
    private DateParser dateParser;

    @Inject
    private Logger logger;

    @Override
    public Optional<PropertyValue> normalize(final NotionProperty property) {
        if (property == null) {
            return Optional.empty();
        }

        return switch (PropertyKind.fromType(property.type())) {
            case TITLE -> richTextToString(property.getTitle()).map(PropertyValue.Text::new);
            case RICH_TEXT -> richTextToString(property.getRichText()).map(PropertyValue.Text::new);
            case SELECT -> optionName(property.select()).map(PropertyValue.Text::new);
            case STATUS -> optionName(property.status()).map(PropertyValue.Text::new);
            case MULTI_SELECT -> toTextList(property.getMultiSelect().stream()
                    .filter(Objects::nonNull)
                    .map(NotionSelectOption::name)
                    .toList());
            // The API sends false rather than nothing
            case CHECKBOX -> Optional.of(new PropertyValue.Bool(Boolean.TRUE.equals(property.checkbox())));
            case NUMBER -> toNumber(property.number());
            case URL -> nonBlank(property.url()).map(PropertyValue.Text::new);
            case EMAIL -> nonBlank(property.email()).map(PropertyValue.Text::new);
            case PHONE_NUMBER -> nonBlank(property.phoneNumber()).map(PropertyValue.Text::new);
            case DATE -> Optional.ofNullable(property.date())
                    .map(NotionDate::start)
                    .flatMap(this::toTimestamp);
            case CREATED_TIME -> toTimestamp(property.createdTime());
            case LAST_EDITED_TIME -> toTimestamp(property.lastEditedTime());
            case PEOPLE -> toTextList(property.getPeople().stream()
                    .filter(Objects::nonNull)
                    .map(NotionUser::name)
                    .toList());
            case UNKNOWN -> Optional.empty();
        };
    }

    /**
     * Concatenates the runs and strips Unicode whitespace from both ends. Whitespace only text is treated as empty.
     */
    public Optional<String> richTextToString(final List<NotionRichText> text) {
        final String combined = text.stream()
                .filter(Objects::nonNull)
                .map(NotionRichText::getPlainText)
                .reduce("", String::concat);

        return nonBlank(StringUtils.strip(combined));
    }

    private Optional<String> optionName(@Nullable final NotionSelectOption option) {
        return Optional.ofNullable(option)
                .map(NotionSelectOption::name)
                .flatMap(this::nonBlank);
    }

    private Optional<PropertyValue> toTextList(final List<String> values) {
        final List<String> names = values.stream()
                .filter(StringUtils::isNotBlank)
                .toList();

        return names.isEmpty()
                ? Optional.empty()
                : Optional.of(new PropertyValue.TextList(names));
    }

    private Optional<PropertyValue> toNumber(@Nullable final BigDecimal number) {
        return Optional.ofNullable(number)
                .map(BigDecimal::doubleValue)
                .filter(Double::isFinite)
                .map(PropertyValue.Number::new);
    }

    /**
     * Bare dates become midnight UTC and date times keep their instant. Values that don't parse are dropped
     * with a warning rather than failing the read.
     */
    private Optional<PropertyValue> toTimestamp(@Nullable final String value) {
        return nonBlank(value)
                .flatMap(date -> Try.of(() -> dateParser.parseDate(date))
                        .onFailure(ex -> logger.warning("Failed to parse Notion date " + date + ": " + ex.getMessage()))
                        .toJavaOptional())
                .map(date -> new PropertyValue.Timestamp(date.toInstant()));
    }

    private Optional<String> nonBlank(@Nullable final String value) {
        return Optional.ofNullable(value).filter(StringUtils::isNotBlank);
    }
}
