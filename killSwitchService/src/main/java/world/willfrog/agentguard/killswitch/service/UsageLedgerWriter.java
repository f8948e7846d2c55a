package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import world.willfrog.agentguard.common.dao.killswitch.UsageEventDao;
import world.willfrog.agentguard.common.pojo.killswitch.UsageEvent;

import java.util.List;

@Component
@RequiredArgsConstructor
public class UsageLedgerWriter {

    private final UsageEventDao usageEventDao;

    /**
     * 同一批事件在一个事务里写入账本。
     */
    @Transactional
    public List<UsageEvent> appendAll(List<UsageEvent> events) {
        for (UsageEvent event : events) {
            usageEventDao.insert(event);
        }
        return events;
    }
}
