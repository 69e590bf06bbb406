package com.roapid.domain;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Maps wiki category labels and artifact file names to {@link JobIdentity} and back.
 * {@link #render} is the inverse of {@link #parse} for the same prefix, and
 * {@link #fromArtifactName} is the inverse of {@link JobIdentity#artifactName()}.
 */
public final class JobIdentityCodec {

    public static final String CATEGORY_NAMESPACE = "Category:";
    public static final String SEPARATOR = "-";
    public static final String ARTIFACT_SUFFIX = ".json";

    /** Removed before matching: comma, no-break space, narrow no-break space. */
    private static final String STRIPPED_CHARS = ",\u00A0\u202F";

    private JobIdentityCodec() {
    }

    /**
     * Parses {@code Category:<prefix>-<type>-<id>}. The prefix match is case-insensitive; only the
     * first separator after the prefix splits type from id. Unicode dash variants are kept as-is.
     *
     * @throws InvalidCategoryException when the label does not match
     */
    public static JobIdentity parse(String category, String prefix) {
        if (category == null || prefix == null || prefix.isEmpty()) {
            throw new InvalidCategoryException(category);
        }
        String normalized = normalize(category);
        String expected = CATEGORY_NAMESPACE + prefix + SEPARATOR;
        if (!normalized.regionMatches(true, 0, expected, 0, expected.length())) {
            throw new InvalidCategoryException(category);
        }
        String remainder = normalized.substring(expected.length());
        int split = remainder.indexOf(SEPARATOR);
        if (split <= 0 || split == remainder.length() - 1) {
            throw new InvalidCategoryException(category);
        }
        return new JobIdentity(remainder.substring(0, split), remainder.substring(split + 1));
    }

    /**
     * Same as {@link #parse} but returns empty instead of throwing.
     */
    public static Optional<JobIdentity> tryParse(String category, String prefix) {
        try {
            return Optional.of(parse(category, prefix));
        } catch (InvalidCategoryException e) {
            return Optional.empty();
        }
    }

    /**
     * Accepts labels naming {@code identity} under {@code prefix}, whatever their prefix casing or spacing.
     */
    public static Predicate<String> sameJob(JobIdentity identity, String prefix) {
        return label -> tryParse(label, prefix).filter(identity::equals).isPresent();
    }

    public static String render(JobIdentity identity, String prefix) {
        return CATEGORY_NAMESPACE + prefix + SEPARATOR + identity.endpointType() + SEPARATOR + identity.instanceId();
    }

    /**
     * Derives the identity from a persisted artifact name {@code <type>-<id>.json}.
     * Names that do not match (e.g. {@code about.json}) yield empty.
     */
    public static Optional<JobIdentity> fromArtifactName(String fileName) {
        if (fileName == null || !fileName.endsWith(ARTIFACT_SUFFIX)) {
            return Optional.empty();
        }
        String base = fileName.substring(0, fileName.length() - ARTIFACT_SUFFIX.length());
        int split = base.indexOf(SEPARATOR);
        if (split <= 0 || split == base.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(new JobIdentity(base.substring(0, split), base.substring(split + 1)));
    }

    static String normalize(String category) {
        StringBuilder sb = new StringBuilder(category.length());
        for (int i = 0; i < category.length(); i++) {
            char c = category.charAt(i);
            if (STRIPPED_CHARS.indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return sb.toString().strip();
    }
}
