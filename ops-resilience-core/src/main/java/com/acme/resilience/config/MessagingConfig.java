package com.acme.resilience.config;

import java.time.Duration;

/**
 * Configuration for the event bus, its consumers and the dead-letter queue. Pure POJO - no
 * framework dependencies.
 */
public class MessagingConfig {

  private String bootstrapServers = "localhost:9092";
  private String groupId = "ops-platform";
  private Duration pollTimeout = Duration.ofSeconds(1);
  private int maxPollRecords = 100;
  private Duration sendTimeout = Duration.ofSeconds(10);
  private Dlq dlq = new Dlq();
  private Topics topics = new Topics();

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public void setBootstrapServers(String bootstrapServers) {
    this.bootstrapServers = bootstrapServers;
  }

  public String getGroupId() {
    return groupId;
  }

  public void setGroupId(String groupId) {
    this.groupId = groupId;
  }

  public Duration getPollTimeout() {
    return pollTimeout;
  }

  public void setPollTimeout(Duration pollTimeout) {
    this.pollTimeout = pollTimeout;
  }

  public int getMaxPollRecords() {
    return maxPollRecords;
  }

  public void setMaxPollRecords(int maxPollRecords) {
    this.maxPollRecords = maxPollRecords;
  }

  public Duration getSendTimeout() {
    return sendTimeout;
  }

  public void setSendTimeout(Duration sendTimeout) {
    this.sendTimeout = sendTimeout;
  }

  public Dlq getDlq() {
    return dlq;
  }

  public void setDlq(Dlq dlq) {
    this.dlq = dlq;
  }

  public Topics getTopics() {
    return topics;
  }

  public void setTopics(Topics topics) {
    this.topics = topics;
  }

  public static class Dlq {
    private boolean enabled = true;
    private int maxRetries = 3;
    private String groupId = "ops-dlq";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public String getGroupId() {
      return groupId;
    }

    public void setGroupId(String groupId) {
      this.groupId = groupId;
    }
  }

  /** Topic provisioning on startup. */
  public static class Topics {
    private boolean provision = true;
    private int partitions = 3;
    private short replicationFactor = 1;

    public boolean isProvision() {
      return provision;
    }

    public void setProvision(boolean provision) {
      this.provision = provision;
    }

    public int getPartitions() {
      return partitions;
    }

    public void setPartitions(int partitions) {
      this.partitions = partitions;
    }

    public short getReplicationFactor() {
      return replicationFactor;
    }

    public void setReplicationFactor(short replicationFactor) {
      this.replicationFactor = replicationFactor;
    }
  }
}
