package datamigrator.mapping;

/**
 * A problem found while compiling a {@link MappingRule}.
 *
 * @param sourceFieldId the source field of the rule, or null
 * @param targetFieldId the target field of the rule, or null for table-level problems
 * @param message what is wrong
 */
public record MappingViolation(String sourceFieldId, String targetFieldId, String message) {

    @Override
    public String toString() {
        if (sourceFieldId == null && targetFieldId == null) {
            return message;
        }
        return (sourceFieldId == null ? "<constant>" : sourceFieldId) + " -> "
                + (targetFieldId == null ? "?" : targetFieldId) + ": " + message;
    }
}
