package world.willfrog.agentguard.killswitch.evaluator;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.agentguard.common.dao.killswitch.SpendRateSnapshotDao;
import world.willfrog.agentguard.killswitch.config.KillSwitchProperties;

import java.time.OffsetDateTime;

@Component
@RequiredArgsConstructor
public class SpendSnapshotCategory implements EvaluationCategory {

    private final SpendRateSnapshotDao spendRateSnapshotDao;
    private final KillSwitchProperties properties;

    @Override
    public String name() {
        return "SPEND_SNAPSHOT";
    }

    @Override
    public int evaluate(OffsetDateTime now) {
        int minutes = Math.max(1, properties.getEvaluator().getSnapshotWindowMinutes());
        return spendRateSnapshotDao.insertWindow(now.minusMinutes(minutes), now, minutes);
    }
}
