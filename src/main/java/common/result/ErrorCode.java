package common.result;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 负载均衡与服务发现的错误类型
 */
@Getter
@AllArgsConstructor
public enum ErrorCode {
    /**
     * 必要参数缺失或为空
     */
    INVALID_INPUT(400, "参数非法"),
    /**
     * 服务没有对应的路由信息
     */
    NOT_FOUND(404, "路由信息不存在"),
    /**
     * 路由信息存在但节点列表为空
     */
    EMPTY_SET(503, "节点列表为空");

    private final int code;
    private final String message;

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return null;
    }
}
