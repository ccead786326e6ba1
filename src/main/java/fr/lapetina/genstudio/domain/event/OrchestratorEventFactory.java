package fr.lapetina.genstudio.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link OrchestratorEvent} instances for the ring buffer.
 * Events are reused by clearing and re-initializing them.
 */
public final class OrchestratorEventFactory implements EventFactory<OrchestratorEvent> {

    @Override
    public OrchestratorEvent newInstance() {
        return new OrchestratorEvent();
    }
}
