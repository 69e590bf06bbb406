package com.roapid.domain;

/**
 * One unit of recurring fetch-and-publish work: endpoint type plus instance id.
 * The instance id may itself be composite (e.g. {@code 123-456} for places).
 */
public record JobIdentity(String endpointType, String instanceId) {

    public JobIdentity {
        if (endpointType == null || endpointType.isEmpty()) {
            throw new IllegalArgumentException("endpointType must not be empty");
        }
        if (instanceId == null || instanceId.isEmpty()) {
            throw new IllegalArgumentException("instanceId must not be empty");
        }
    }

    /**
     * Artifact file name and wiki page suffix: {@code <endpointType>-<instanceId>.json}.
     */
    public String artifactName() {
        return endpointType + JobIdentityCodec.SEPARATOR + instanceId + JobIdentityCodec.ARTIFACT_SUFFIX;
    }
}
