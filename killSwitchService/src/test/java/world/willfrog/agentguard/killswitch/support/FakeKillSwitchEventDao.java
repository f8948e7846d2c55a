package world.willfrog.agentguard.killswitch.support;

import world.willfrog.agentguard.common.dao.killswitch.KillSwitchEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEvent;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;

public class FakeKillSwitchEventDao implements KillSwitchEventDao {

    private final InMemoryKillSwitchStore store;

    public FakeKillSwitchEventDao(InMemoryKillSwitchStore store) {
        this.store = store;
    }

    @Override
    public int insert(KillSwitchEvent event) {
        synchronized (store) {
            event.setId(store.ids.incrementAndGet());
            event.setCreatedAt(OffsetDateTime.now(store.clock));
            store.auditEvents.add(event);
            return 1;
        }
    }

    @Override
    public List<KillSwitchEvent> listRecent(String ownerId, int limit) {
        return listByTarget(ownerId, null, null, limit);
    }

    @Override
    public List<KillSwitchEvent> listByTarget(String ownerId, TargetType targetType, String targetId, int limit) {
        synchronized (store) {
            return store.auditEvents.stream()
                    .filter(e -> ownerId.equals(e.getOwnerId()) || e.getTargetType() == TargetType.GLOBAL)
                    .filter(e -> targetType == null || e.getTargetType() == targetType)
                    .filter(e -> targetId == null || targetId.equals(e.getTargetId()))
                    .sorted(Comparator.comparing(KillSwitchEvent::getId).reversed())
                    .limit(limit)
                    .toList();
        }
    }
}
