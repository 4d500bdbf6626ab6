package com.bookharvest.core.tier.multiprocess;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/** 프로세스 간 줄 단위 JSON 코덱(NDJSON). 한 메시지 = 한 줄. */
public final class ShardChannel {
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private ShardChannel() {}

    public static String encode(ShardMessage m) { return GSON.toJson(m); }

    public static ShardMessage decode(String line) {
        ShardMessage m = GSON.fromJson(line, ShardMessage.class);
        if (m == null || m.type() == null) throw new JsonParseException("not a shard message: " + line);
        return m;
    }

    public static String encodeAssignment(ShardAssignment a) { return GSON.toJson(a); }

    public static ShardAssignment decodeAssignment(String line) {
        ShardAssignment a = GSON.fromJson(line, ShardAssignment.class);
        if (a == null) throw new JsonParseException("empty assignment");
        return a;
    }
}
