package termui.runtime.session;

/**
 * 会话事件回调，在执行线程上调用
 */
public interface SessionListener {

    SessionListener NONE = new SessionListener() {
    };

    /** 块执行成功 */
    default void onBlockCompleted(ScriptSession session, BlockOutcome outcome) {
    }

    /** 块有语法错误、编译失败或运行时故障 */
    default void onBlockFailed(ScriptSession session, BlockOutcome outcome) {
    }

    default void onSessionDestroyed(ScriptSession session) {
    }
}
