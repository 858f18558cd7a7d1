package client.serviceCenter.balance.hash;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * 取模哈希负载均衡可选的哈希算法，按名称选择。
 * 结果按无符号 64 位整数解释，调用方需使用 {@link Long#remainderUnsigned(long, long)} 取模。
 */
public enum HashFunction {
    MURMUR3("murmur3") {
        @Override
        public long hash(String input) {
            return Hashing.murmur3_128().hashString(input, StandardCharsets.UTF_8).asLong();
        }
    },
    MD5("md5") {
        @Override
        @SuppressWarnings("deprecation")
        public long hash(String input) {
            return Hashing.md5().hashString(input, StandardCharsets.UTF_8).asLong();
        }
    },
    BKDR("bkdr") {
        @Override
        public long hash(String input) {
            long h = 0;
            for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
                h = h * BKDR_SEED + (b & 0xff);
            }
            return h;
        }
    },
    FNV1A("fnv1a") {
        @Override
        public long hash(String input) {
            long h = FNV_OFFSET_BASIS;
            for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
                h ^= (b & 0xff);
                h *= FNV_PRIME;
            }
            return h;
        }
    };

    /**
     * 未配置或无法识别时使用的算法
     */
    public static final HashFunction DEFAULT = MURMUR3;

    private static final long BKDR_SEED = 131L;
    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final String funcName;

    HashFunction(String funcName) {
        this.funcName = funcName;
    }

    public String getFuncName() {
        return funcName;
    }

    public abstract long hash(String input);

    /**
     * 按名称查找算法，名称区分大小写，未知名称回退到 {@link #DEFAULT}
     */
    public static HashFunction of(String funcName) {
        if (funcName != null) {
            for (HashFunction function : values()) {
                if (function.funcName.equals(funcName)) {
                    return function;
                }
            }
        }
        return DEFAULT;
    }

    public static long hash(String funcName, String input) {
        return of(funcName).hash(input);
    }
}
