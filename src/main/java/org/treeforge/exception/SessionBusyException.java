package org.treeforge.exception;

/**
 * 同一会话已有预览/应用正在执行。稍后重试即可，不需要修改文本。
 */
public class SessionBusyException extends TreeForgeException {

    private final String sessionId;

    public SessionBusyException(String sessionId) {
        super("会话正在执行其他操作，请稍后重试：" + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
