package com.finsight.forecast;

import com.finsight.model.ForecastArtifact;
import com.finsight.model.ModelSnapshot;

import java.util.Optional;

public final class ForecastOutcome {
    public final ForecastArtifact artifact;
    public final ModelSnapshot snapshot;
    public final boolean retrained;

    public ForecastOutcome(ForecastArtifact artifact, ModelSnapshot snapshot, boolean retrained) {
        this.artifact = artifact;
        this.snapshot = snapshot;
        this.retrained = retrained;
    }

    /**
     * Present only when this call trained a new model that should be persisted.
     */
    public Optional<ModelSnapshot> trainedSnapshot() {
        return retrained ? Optional.ofNullable(snapshot) : Optional.empty();
    }
}
