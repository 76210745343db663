/*
 * どこで: Reminder データアクセス
 * 何を: Redis の hash(本体) と sorted set(期限インデックス) でリマインダーを管理する
 * なぜ: キー単位の取消/置換を O(1) で行い、プロセス再起動後も保留分を保持するため
 */
package com.incidentdesk.incident.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.ReminderRecord;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

@Repository
public class RedisReminderRepository implements ReminderRepository {

  private static final Logger logger = LoggerFactory.getLogger(RedisReminderRepository.class);

  static final String DUE_KEY = "incident:reminder:due";

  private static final String FIELD_TICKET_KEY = "ticket_key";
  private static final String FIELD_KIND = "kind";
  private static final String FIELD_TOKEN = "token";
  private static final String FIELD_DUE_AT = "due_at";
  private static final String FIELD_INTERVAL_MINUTES = "interval_minutes";
  private static final String FIELD_SNAPSHOT = "snapshot";
  private static final String FIELD_CREATED_AT = "created_at";

  // 旧エントリの退役と新エントリの登録を 1 スクリプトで行い、同一キーの二重登録を防ぐ
  private static final RedisScript<Long> INSTALL_SCRIPT =
      new DefaultRedisScript<>(
          """
          redis.call('DEL', KEYS[1])
          redis.call('ZREM', KEYS[2], ARGV[1])
          redis.call('HSET', KEYS[1], unpack(ARGV, 3))
          redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])
          return 1
          """,
          Long.class);

  private static final RedisScript<Long> REPLACE_IF_CURRENT_SCRIPT =
      new DefaultRedisScript<>(
          """
          if redis.call('HGET', KEYS[1], 'token') ~= ARGV[3] then
            return 0
          end
          redis.call('DEL', KEYS[1])
          redis.call('HSET', KEYS[1], unpack(ARGV, 4))
          redis.call('ZADD', KEYS[2], ARGV[2], ARGV[1])
          return 1
          """,
          Long.class);

  private static final RedisScript<Long> REMOVE_SCRIPT =
      new DefaultRedisScript<>(
          """
          local removed = redis.call('DEL', KEYS[1])
          redis.call('ZREM', KEYS[2], ARGV[1])
          return removed
          """,
          Long.class);

  private static final RedisScript<Long> REMOVE_IF_CURRENT_SCRIPT =
      new DefaultRedisScript<>(
          """
          local token = redis.call('HGET', KEYS[1], 'token')
          if token and token ~= ARGV[2] then
            return 0
          end
          local removed = redis.call('DEL', KEYS[1])
          redis.call('ZREM', KEYS[2], ARGV[1])
          return removed
          """,
          Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final ObjectMapper objectMapper;

  public RedisReminderRepository(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public void install(ReminderRecord reminder) {
    final List<String> args = new ArrayList<>();
    args.add(member(reminder.ticketKey(), reminder.kind()));
    args.add(score(reminder.dueAt()));
    args.addAll(fieldArgs(reminder));
    redisTemplate.execute(
        INSTALL_SCRIPT,
        List.of(reminderKey(reminder.ticketKey(), reminder.kind()), DUE_KEY),
        args.toArray());
  }

  @Override
  public boolean replaceIfCurrent(String expectedToken, ReminderRecord replacement) {
    final List<String> args = new ArrayList<>();
    args.add(member(replacement.ticketKey(), replacement.kind()));
    args.add(score(replacement.dueAt()));
    args.add(expectedToken);
    args.addAll(fieldArgs(replacement));
    final Long replaced =
        redisTemplate.execute(
            REPLACE_IF_CURRENT_SCRIPT,
            List.of(reminderKey(replacement.ticketKey(), replacement.kind()), DUE_KEY),
            args.toArray());
    return replaced != null && replaced > 0;
  }

  @Override
  public boolean remove(String ticketKey, ReminderKind kind) {
    final Long removed =
        redisTemplate.execute(
            REMOVE_SCRIPT,
            List.of(reminderKey(ticketKey, kind), DUE_KEY),
            member(ticketKey, kind));
    return removed != null && removed > 0;
  }

  @Override
  public boolean removeIfCurrent(String ticketKey, ReminderKind kind, String token) {
    final Long removed =
        redisTemplate.execute(
            REMOVE_IF_CURRENT_SCRIPT,
            List.of(reminderKey(ticketKey, kind), DUE_KEY),
            member(ticketKey, kind),
            token);
    return removed != null && removed > 0;
  }

  @Override
  public Optional<ReminderRecord> find(String ticketKey, ReminderKind kind) {
    final Map<Object, Object> raw = redisTemplate.opsForHash().entries(reminderKey(ticketKey, kind));
    if (raw == null || raw.isEmpty()) {
      return Optional.empty();
    }
    final Map<String, String> fields = normalizeFields(raw);
    try {
      return Optional.of(toRecord(fields));
    } catch (IllegalArgumentException | IllegalStateException | DateTimeException ex) {
      // 読めない本体は配信も再登録もできないため、内容をログに残して取り除く
      logger.error("corrupt reminder removed ticketKey={} kind={} fields={}",
          ticketKey, kind.value(), fields, ex);
      remove(ticketKey, kind);
      return Optional.empty();
    }
  }

  @Override
  public Stream<ReminderRecord> findDue(Instant now, int limit) {
    final Set<String> members =
        redisTemplate
            .opsForZSet()
            .rangeByScore(DUE_KEY, Double.NEGATIVE_INFINITY, now.toEpochMilli(), 0, limit);
    if (members == null || members.isEmpty()) {
      return Stream.empty();
    }
    // 本体の読み込みは消費時まで遅延させる
    return members.stream().map(this::loadByMember).filter(Objects::nonNull);
  }

  @Override
  public long countPending() {
    final Long size = redisTemplate.opsForZSet().zCard(DUE_KEY);
    return size == null ? 0 : size;
  }

  static String reminderKey(String ticketKey, ReminderKind kind) {
    return "incident:reminder:" + ticketKey + ":" + kind.value();
  }

  static String member(String ticketKey, ReminderKind kind) {
    return ticketKey + ":" + kind.value();
  }

  private ReminderRecord loadByMember(String member) {
    final int separator = member.lastIndexOf(':');
    if (separator <= 0) {
      logger.warn("malformed reminder index member={}", member);
      redisTemplate.opsForZSet().remove(DUE_KEY, member);
      return null;
    }
    final String ticketKey = member.substring(0, separator);
    final ReminderKind kind;
    try {
      kind = ReminderKind.fromValue(member.substring(separator + 1));
    } catch (IllegalArgumentException ex) {
      logger.warn("reminder index with unknown kind removed member={}", member);
      redisTemplate.opsForZSet().remove(DUE_KEY, member);
      return null;
    }
    final Optional<ReminderRecord> reminder = find(ticketKey, kind);
    if (reminder.isEmpty()) {
      // 本体を失ったインデックスは配信できないため掃除する
      logger.warn("orphan reminder index removed ticketKey={} kind={}", ticketKey, kind.value());
      redisTemplate.opsForZSet().remove(DUE_KEY, member);
      return null;
    }
    return reminder.get();
  }

  private List<String> fieldArgs(ReminderRecord reminder) {
    return List.of(
        FIELD_TICKET_KEY, reminder.ticketKey(),
        FIELD_KIND, reminder.kind().value(),
        FIELD_TOKEN, reminder.token(),
        FIELD_DUE_AT, reminder.dueAt().toString(),
        FIELD_INTERVAL_MINUTES, Integer.toString(reminder.intervalMinutes()),
        FIELD_SNAPSHOT, writeSnapshot(reminder.snapshot()),
        FIELD_CREATED_AT, reminder.createdAt().toString());
  }

  private ReminderRecord toRecord(Map<String, String> fields) {
    return new ReminderRecord(
        required(fields, FIELD_TICKET_KEY),
        ReminderKind.fromValue(required(fields, FIELD_KIND)),
        required(fields, FIELD_TOKEN),
        Instant.parse(required(fields, FIELD_DUE_AT)),
        Integer.parseInt(required(fields, FIELD_INTERVAL_MINUTES)),
        readSnapshot(required(fields, FIELD_SNAPSHOT)),
        Instant.parse(required(fields, FIELD_CREATED_AT)));
  }

  private String required(Map<String, String> fields, String name) {
    final String value = fields.get(name);
    if (value == null) {
      throw new IllegalStateException("reminder field missing: " + name);
    }
    return value;
  }

  private String writeSnapshot(IncidentSnapshot snapshot) {
    try {
      return objectMapper.writeValueAsString(snapshot);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize reminder snapshot", ex);
    }
  }

  private IncidentSnapshot readSnapshot(String json) {
    try {
      return objectMapper.readValue(json, IncidentSnapshot.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to parse reminder snapshot", ex);
    }
  }

  private String score(Instant dueAt) {
    return Long.toString(dueAt.toEpochMilli());
  }

  private Map<String, String> normalizeFields(Map<Object, Object> raw) {
    final Map<String, String> map = new HashMap<>();
    for (Map.Entry<Object, Object> e : raw.entrySet()) {
      map.put(
          String.valueOf(e.getKey()), e.getValue() == null ? null : String.valueOf(e.getValue()));
    }
    return map;
  }
}
