package org.carball.planlens.model.mongo;

public record MongoServerInfo(String host, int port, String version) {

    public static MongoServerInfo empty() {
        return new MongoServerInfo("", 0, "");
    }
}
