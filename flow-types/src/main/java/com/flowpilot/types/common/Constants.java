package com.flowpilot.types.common;

/**
 * 全局常量。
 */
public class Constants {

    /** 运行暂停等待用户输入时写入输出的标记消息 */
    public final static String WAITING_FOR_USER_MESSAGE = "WAITING_FOR_USER";

    /** 用户取消运行时的错误信息 */
    public final static String RUN_CANCELLED_MESSAGE = "Run cancelled by user";

    /** 单个 Agent 允许绑定的最大工具数 */
    public final static int MAX_TOOLS_PER_CREATED_AGENT = 10;

    /** 暂停节点未给出问题时使用的默认提示 */
    public final static String DEFAULT_WAIT_QUESTION = "Please respond to continue.";

    /** ask_user 未给出问题时使用的默认提示 */
    public final static String DEFAULT_ASK_QUESTION = "Please provide the information or confirmation.";

    /** 执行日志单条载荷最大长度 */
    public final static int EXECUTION_LOG_PAYLOAD_MAX = 8000;

}
