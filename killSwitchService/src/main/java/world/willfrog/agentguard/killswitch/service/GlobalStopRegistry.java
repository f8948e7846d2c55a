package world.willfrog.agentguard.killswitch.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.GlobalStopDao;
import world.willfrog.agentguard.common.pojo.killswitch.GlobalStop;

import java.time.OffsetDateTime;

/**
 * 全局急停开关。准入时只读，不修改任何 agent 的状态。
 */
@Component
@RequiredArgsConstructor
public class GlobalStopRegistry {

    private final GlobalStopDao globalStopDao;

    public GlobalStop current() {
        GlobalStop stop = globalStopDao.load();
        return stop == null ? GlobalStop.inactive() : stop;
    }

    void activate(String reason, String actor, OffsetDateTime at) {
        globalStopDao.activate(reason, actor, at);
    }

    /**
     * @return 是否从激活状态切换为关闭
     */
    boolean clear() {
        return globalStopDao.clear() > 0;
    }
}
