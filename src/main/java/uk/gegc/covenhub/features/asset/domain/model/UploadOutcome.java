package uk.gegc.covenhub.features.asset.domain.model;

/**
 * Result of dispatching an {@link UploadPayload}. Direct uploads always carry an asset;
 * chunk admissions carry progress, plus the asset when that chunk completed the session.
 */
public record UploadOutcome(UploadProgress progress, Asset asset) {

    public static UploadOutcome stored(Asset asset) {
        return new UploadOutcome(null, asset);
    }

    public static UploadOutcome admitted(UploadProgress progress, Asset asset) {
        return new UploadOutcome(progress, asset);
    }
}
