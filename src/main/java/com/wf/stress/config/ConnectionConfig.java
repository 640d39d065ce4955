package com.wf.stress.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class ConnectionConfig {

    private String database = "stress";
    private String username = "";
    private String password = "";
    private String authDatabase = "admin";
    private boolean tls = false;
    private String writeConcern = "acknowledged";
    private int connectionPoolSize = 10;
    private int connectionTimeoutMs = 30000;
    private int socketTimeoutMs = 60000;

    public ConnectionConfig() {
    }

    public MongoClient createClient(Endpoint endpoint) {
        ConnectionString connString = new ConnectionString(toConnectionString(endpoint));

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
            .applyConnectionString(connString)
            .writeConcern(resolveWriteConcern())
            .applyToSslSettings(ssl -> ssl.enabled(tls))
            .applyToConnectionPoolSettings(pool -> pool
                .maxSize(connectionPoolSize)
                .minSize(1)
                .maxWaitTime(connectionTimeoutMs, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(socket -> socket
                .connectTimeout(connectionTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout(socketTimeoutMs, TimeUnit.MILLISECONDS));

        if (hasCredentials()) {
            builder.credential(MongoCredential.createCredential(
                username, authDatabase, password.toCharArray()));
        }

        return MongoClients.create(builder.build());
    }

    public String toConnectionString(Endpoint endpoint) {
        return "mongodb://" + endpoint.toSeedList() + "/";
    }

    public WriteConcern resolveWriteConcern() {
        switch (writeConcern.toLowerCase(Locale.ROOT)) {
            case "acknowledged":
                return WriteConcern.ACKNOWLEDGED;
            case "unacknowledged":
                return WriteConcern.UNACKNOWLEDGED;
            case "majority":
                return WriteConcern.MAJORITY;
            default:
                throw new ConfigException("Unknown write concern: " + writeConcern);
        }
    }

    public boolean hasCredentials() {
        return username != null && !username.isEmpty();
    }

    // Getters and setters
    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getAuthDatabase() {
        return authDatabase;
    }

    public void setAuthDatabase(String authDatabase) {
        this.authDatabase = authDatabase;
    }

    public boolean isTls() {
        return tls;
    }

    public void setTls(boolean tls) {
        this.tls = tls;
    }

    public String getWriteConcern() {
        return writeConcern;
    }

    public void setWriteConcern(String writeConcern) {
        this.writeConcern = writeConcern;
    }

    public int getConnectionPoolSize() {
        return connectionPoolSize;
    }

    public void setConnectionPoolSize(int connectionPoolSize) {
        this.connectionPoolSize = connectionPoolSize;
    }

    public int getConnectionTimeoutMs() {
        return connectionTimeoutMs;
    }

    public void setConnectionTimeoutMs(int connectionTimeoutMs) {
        this.connectionTimeoutMs = connectionTimeoutMs;
    }

    public int getSocketTimeoutMs() {
        return socketTimeoutMs;
    }

    public void setSocketTimeoutMs(int socketTimeoutMs) {
        this.socketTimeoutMs = socketTimeoutMs;
    }
}
