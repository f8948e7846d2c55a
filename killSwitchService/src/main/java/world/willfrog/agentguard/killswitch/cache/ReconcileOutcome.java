package world.willfrog.agentguard.killswitch.cache;

public enum ReconcileOutcome {
    /** 没有在途准入，累计值已改写为账本值 */
    OVERWRITTEN,
    /** 有在途准入或新完成的准入，累计值低于账本值，已上调 */
    RAISED,
    /** 有在途准入或新完成的准入，累计值不低于账本值，保持不变 */
    KEPT;

    static ReconcileOutcome of(long code) {
        return values()[(int) code];
    }
}
