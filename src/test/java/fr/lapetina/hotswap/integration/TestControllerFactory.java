package fr.lapetina.hotswap.integration;

import fr.lapetina.hotswap.ControllerFactory;
import fr.lapetina.hotswap.infrastructure.config.ConfigLoader;
import fr.lapetina.hotswap.infrastructure.config.HotSwapConfig;
import fr.lapetina.hotswap.support.FakeSupervisorGateway;

import java.nio.file.Path;
import java.util.List;

/**
 * Test extension of ControllerFactory backed by an in-memory supervisor.
 * Workers are real HTTP endpoints; only process control is faked.
 */
public final class TestControllerFactory extends ControllerFactory {

    private final FakeSupervisorGateway fakeGateway;

    private TestControllerFactory(HotSwapConfig config, FakeSupervisorGateway gateway) {
        super(config, gateway, null);
        this.fakeGateway = gateway;
    }

    /**
     * Creates a factory from test-config.yaml, pointing the greeter model at the given
     * worker URLs and storing artifacts under {@code artifactRoot}.
     */
    public static TestControllerFactory create(Path artifactRoot, String slotAUrl, String slotBUrl, String uiUrl) {
        HotSwapConfig config = new ConfigLoader("test-config.yaml").load();
        config.getStorage().setArtifactRoot(artifactRoot.toString());
        config.getSupervisor().setUiUrl(uiUrl);
        config.getWorkers().setHealthPath("/");

        HotSwapConfig.ModelConfig greeter = new HotSwapConfig.ModelConfig();
        greeter.setName("greeter");
        greeter.setSlotAUrl(slotAUrl);
        greeter.setSlotBUrl(slotBUrl);
        config.setModels(List.of(greeter));

        return new TestControllerFactory(config, new FakeSupervisorGateway());
    }

    public FakeSupervisorGateway getFakeGateway() {
        return fakeGateway;
    }
}
