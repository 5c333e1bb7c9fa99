package fr.lapetina.hotswap.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import fr.lapetina.hotswap.domain.model.ArtifactVersion;
import fr.lapetina.hotswap.lifecycle.LifecycleController;

/**
 * Response body of an artifact upload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadReceipt {

    private String model;
    private long version;
    private String hash;
    private String outcome;

    public UploadReceipt() {
    }

    public static UploadReceipt of(ArtifactVersion artifact, LifecycleController.SubmitResult result) {
        UploadReceipt receipt = new UploadReceipt();
        receipt.setModel(artifact.modelName());
        receipt.setVersion(artifact.version());
        receipt.setHash(artifact.contentHash());
        receipt.setOutcome(result.name());
        return receipt;
    }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public String getHash() { return hash; }
    public void setHash(String hash) { this.hash = hash; }

    public String getOutcome() { return outcome; }
    public void setOutcome(String outcome) { this.outcome = outcome; }
}
