package fr.lapetina.hotswap.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.hotswap.domain.event.LifecycleEvent;
import fr.lapetina.hotswap.lifecycle.ModelStatus;

import java.util.List;

/**
 * Status of one model as served by {@code GET /model/{name}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelStatusView {

    private ModelStatus status;

    @JsonProperty("recent_events")
    private List<LifecycleEvent> recentEvents;

    public ModelStatusView() {
    }

    public ModelStatusView(ModelStatus status, List<LifecycleEvent> recentEvents) {
        this.status = status;
        this.recentEvents = recentEvents;
    }

    public ModelStatus getStatus() { return status; }
    public void setStatus(ModelStatus status) { this.status = status; }

    public List<LifecycleEvent> getRecentEvents() { return recentEvents; }
    public void setRecentEvents(List<LifecycleEvent> recentEvents) { this.recentEvents = recentEvents; }
}
