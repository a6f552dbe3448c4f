package com.example.reme.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Checks applied to each imported record before it reaches the store: the required fields
 * first, then a trial conversion into the domain's model class so nothing is stored that a
 * typed read would later choke on.
 */
public class RecordValidator {
    private enum Kind { TEXT, ARRAY, NUMBER }

    private static final class FieldRule {
        final String field; final Kind kind;
        FieldRule(String field, Kind kind) { this.field = field; this.kind = kind; }
    }

    private final List<FieldRule> rules = new ArrayList<>();
    private final ObjectMapper mapper = JsonStorage.mapper();
    private Class<?> modelType;

    private RecordValidator text(String... fields) { for (String f : fields) rules.add(new FieldRule(f, Kind.TEXT)); return this; }
    private RecordValidator array(String... fields) { for (String f : fields) rules.add(new FieldRule(f, Kind.ARRAY)); return this; }
    private RecordValidator number(String... fields) { for (String f : fields) rules.add(new FieldRule(f, Kind.NUMBER)); return this; }

    private RecordValidator readableAs(Class<?> type) { this.modelType = type; return this; }

    public static RecordValidator forDomain(Domain domain) {
        return rulesFor(domain).readableAs(domain.modelType);
    }

    private static RecordValidator rulesFor(Domain domain) {
        switch (domain) {
            case INGREDIENTS: return new RecordValidator().text("id", "name", "normalizedName", "category").array("synonyms");
            case RECIPES: return new RecordValidator().text("id", "name").array("ingredients", "steps");
            case APPLIANCES: return new RecordValidator().text("id", "name", "category");
            case INVENTORY: return new RecordValidator().text("id", "ingredientId", "location").number("quantity");
            case USER_APPLIANCES: return new RecordValidator().text("id", "applianceId");
            case RECIPE_HISTORY: return new RecordValidator().text("id", "recipeId", "startedAt");
            default: throw new IllegalArgumentException("No validator for " + domain);
        }
    }

    /** Empty when the record is acceptable. */
    public List<ValidationFailure> validate(int index, JsonNode record) {
        List<ValidationFailure> out = new ArrayList<>();
        if (record == null || !record.isObject()) {
            out.add(new ValidationFailure(index, null, ValidationFailure.Reason.NOT_AN_OBJECT));
            return out;
        }
        for (FieldRule rule : rules) {
            JsonNode value = record.get(rule.field);
            boolean absent = value == null || value.isNull();
            switch (rule.kind) {
                case TEXT:
                    if (absent || value.asText().isEmpty() || value.isContainerNode()) {
                        out.add(new ValidationFailure(index, rule.field, ValidationFailure.Reason.MISSING_FIELD));
                    }
                    break;
                case ARRAY:
                    if (absent) out.add(new ValidationFailure(index, rule.field, ValidationFailure.Reason.MISSING_FIELD));
                    else if (!value.isArray()) out.add(new ValidationFailure(index, rule.field, ValidationFailure.Reason.NOT_AN_ARRAY));
                    break;
                case NUMBER:
                    if (absent) out.add(new ValidationFailure(index, rule.field, ValidationFailure.Reason.MISSING_FIELD));
                    else if (!value.isNumber()) out.add(new ValidationFailure(index, rule.field, ValidationFailure.Reason.NOT_A_NUMBER));
                    break;
            }
        }
        if (out.isEmpty() && modelType != null) checkReadable(index, record, out);
        return out;
    }

    private void checkReadable(int index, JsonNode record, List<ValidationFailure> out) {
        try {
            mapper.treeToValue(record, modelType);
        } catch (MismatchedInputException ex) {
            out.add(new ValidationFailure(index, fieldOf(ex), ValidationFailure.Reason.WRONG_TYPE));
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            out.add(new ValidationFailure(index, null, ValidationFailure.Reason.WRONG_TYPE));
        }
    }

    /** Dotted path of the offending field, e.g. {@code steps.0.duration}. */
    private static String fieldOf(MismatchedInputException ex) {
        StringJoiner path = new StringJoiner(".");
        for (JsonMappingException.Reference ref : ex.getPath()) {
            path.add(ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()));
        }
        return path.length() == 0 ? null : path.toString();
    }
}
