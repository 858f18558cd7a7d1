package common.result;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * 通用返回结果封装类
 * @param <T> 数据类型
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Result<T> implements Serializable {
    /**
     * 是否成功
     */
    private boolean success;

    /**
     * 返回码
     */
    private int code;

    /**
     * 返回消息
     */
    private String message;

    /**
     * 返回数据
     */
    private T data;

    /**
     * 成功返回结果
     * @param data 返回数据
     * @param <T> 数据类型
     * @return 成功的结果对象
     */
    public static <T> Result<T> success(T data) {
        return new Result<>(true, 200, "操作成功", data);
    }

    /**
     * 无返回数据的成功结果
     */
    public static Result<Void> success() {
        return new Result<>(true, 200, "操作成功", null);
    }

    /**
     * 失败返回结果，使用错误类型的默认消息
     * @param errorCode 错误类型
     * @param <T> 数据类型
     * @return 失败的结果对象
     */
    public static <T> Result<T> fail(ErrorCode errorCode) {
        return new Result<>(false, errorCode.getCode(), errorCode.getMessage(), null);
    }

    /**
     * 失败返回结果
     * @param errorCode 错误类型
     * @param message 错误消息
     * @param <T> 数据类型
     * @return 失败的结果对象
     */
    public static <T> Result<T> fail(ErrorCode errorCode, String message) {
        return new Result<>(false, errorCode.getCode(), message, null);
    }

    /**
     * 根据返回码解析错误类型，成功结果返回 null
     */
    public ErrorCode errorCode() {
        return success ? null : ErrorCode.fromCode(code);
    }
}
