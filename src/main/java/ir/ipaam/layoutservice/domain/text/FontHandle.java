package ir.ipaam.layoutservice.domain.text;

/**
 * A font resolved by the metrics collaborator. {@code name} is the collaborator's own
 * identifier, which the PDF writer uses to pick the same face.
 */
public record FontHandle(String family, boolean bold, boolean italic, String name) {
}
