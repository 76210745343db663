/*
 * どこで: Reminder リポジトリの統合テスト
 * 何を: Lua による登録/置換/削除と期限インデックスを実 Redis で検証する
 * なぜ: 1 キー 1 件の保証と取消の冪等性がスクリプトで崩れないことを保証するため
 */
package com.incidentdesk.incident.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.incidentdesk.incident.AbstractStorageContainerTest;
import com.incidentdesk.incident.model.IncidentRecord;
import com.incidentdesk.incident.model.IncidentSnapshot;
import com.incidentdesk.incident.model.ReminderKind;
import com.incidentdesk.incident.model.ReminderRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class RedisReminderRepositoryTest extends AbstractStorageContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private RedisReminderRepository repository;

  @Autowired private StringRedisTemplate redisTemplate;

  @BeforeEach
  void cleanup() {
    redisTemplate.execute(
        connection -> {
          connection.serverCommands().flushDb();
          return null;
        },
        true);
  }

  @Test
  void installStoresBodyAndDueIndex() {
    final ReminderRecord reminder = reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME);

    repository.install(reminder);

    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).contains(reminder);
    assertThat(repository.countPending()).isEqualTo(1);
  }

  @Test
  void installReplacesExistingReminderForSameKey() {
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME));
    final ReminderRecord later =
        reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.plus(Duration.ofMinutes(5)));

    repository.install(later);

    assertThat(repository.countPending()).isEqualTo(1);
    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).contains(later);
    assertThat(repository.findDue(BASE_TIME.plusSeconds(1), 10)).isEmpty();
  }

  @Test
  void kindsOfSameIncidentAreIndependent() {
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME));
    repository.install(reminder("INC-1", ReminderKind.AWAITING_RESPONSE, BASE_TIME));

    assertThat(repository.countPending()).isEqualTo(2);

    assertThat(repository.remove("INC-1", ReminderKind.DEFAULT)).isTrue();
    assertThat(repository.find("INC-1", ReminderKind.AWAITING_RESPONSE)).isPresent();
  }

  @Test
  void removeIsIdempotent() {
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME));

    assertThat(repository.remove("INC-1", ReminderKind.DEFAULT)).isTrue();
    assertThat(repository.remove("INC-1", ReminderKind.DEFAULT)).isFalse();
    assertThat(repository.remove("INC-404", ReminderKind.AWAITING_RESPONSE)).isFalse();
    assertThat(repository.countPending()).isZero();
  }

  @Test
  void findDueReturnsElapsedRemindersInDueOrderWithoutRemovingThem() {
    repository.install(reminder("INC-2", ReminderKind.DEFAULT, BASE_TIME.minusSeconds(10)));
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.minusSeconds(30)));
    repository.install(reminder("INC-3", ReminderKind.DEFAULT, BASE_TIME.plusSeconds(30)));

    final List<ReminderRecord> first = repository.findDue(BASE_TIME, 10).toList();
    final List<ReminderRecord> second = repository.findDue(BASE_TIME, 10).toList();

    assertThat(first).extracting(ReminderRecord::ticketKey).containsExactly("INC-1", "INC-2");
    assertThat(second).isEqualTo(first);
  }

  @Test
  void findDueHonorsLimit() {
    for (int i = 0; i < 5; i++) {
      repository.install(
          reminder("INC-" + i, ReminderKind.DEFAULT, BASE_TIME.minusSeconds(60 - i)));
    }

    assertThat(repository.findDue(BASE_TIME, 2).toList())
        .extracting(ReminderRecord::ticketKey)
        .containsExactly("INC-0", "INC-1");
  }

  @Test
  void findDueDropsIndexEntriesWhoseBodyIsGone() {
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.minusSeconds(5)));
    redisTemplate.delete(RedisReminderRepository.reminderKey("INC-1", ReminderKind.DEFAULT));

    assertThat(repository.findDue(BASE_TIME, 10).toList()).isEmpty();
    assertThat(repository.countPending()).isZero();
  }

  @Test
  void corruptReminderBodyIsRemovedAndDoesNotHideLaterReminders() {
    repository.install(reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.minusSeconds(30)));
    repository.install(reminder("INC-2", ReminderKind.DEFAULT, BASE_TIME.minusSeconds(10)));
    redisTemplate
        .opsForHash()
        .put(RedisReminderRepository.reminderKey("INC-1", ReminderKind.DEFAULT), "due_at", "soon");

    assertThat(repository.findDue(BASE_TIME, 10).toList())
        .extracting(ReminderRecord::ticketKey)
        .containsExactly("INC-2");
    assertThat(redisTemplate.hasKey(
            RedisReminderRepository.reminderKey("INC-1", ReminderKind.DEFAULT)))
        .isFalse();
    assertThat(repository.countPending()).isEqualTo(1);
  }

  @Test
  void indexMemberWithUnknownKindIsRemoved() {
    redisTemplate
        .opsForZSet()
        .add(RedisReminderRepository.DUE_KEY, "INC-1:escalation", BASE_TIME.toEpochMilli() - 1000);

    assertThat(repository.findDue(BASE_TIME, 10).toList()).isEmpty();
    assertThat(repository.countPending()).isZero();
  }

  @Test
  void ticketKeysContainingColonAreResolved() {
    repository.install(reminder("OPS:INC-1", ReminderKind.AWAITING_RESPONSE, BASE_TIME));

    assertThat(repository.findDue(BASE_TIME, 10).toList())
        .extracting(ReminderRecord::ticketKey)
        .containsExactly("OPS:INC-1");
  }

  @Test
  void replaceIfCurrentRequiresMatchingToken() {
    final ReminderRecord observed = reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME);
    repository.install(observed);
    final ReminderRecord next =
        reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.plus(Duration.ofMinutes(2)));

    assertThat(repository.replaceIfCurrent("stale-token", next)).isFalse();
    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).contains(observed);

    assertThat(repository.replaceIfCurrent(observed.token(), next)).isTrue();
    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).contains(next);
    assertThat(repository.countPending()).isEqualTo(1);
  }

  @Test
  void replaceIfCurrentDoesNotResurrectCanceledReminder() {
    final ReminderRecord observed = reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME);
    repository.install(observed);
    repository.remove("INC-1", ReminderKind.DEFAULT);

    final boolean replaced =
        repository.replaceIfCurrent(
            observed.token(),
            reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.plus(Duration.ofMinutes(2))));

    assertThat(replaced).isFalse();
    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).isEmpty();
    assertThat(repository.countPending()).isZero();
  }

  @Test
  void removeIfCurrentKeepsNewerReminder() {
    final ReminderRecord observed = reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME);
    repository.install(observed);
    final ReminderRecord newer =
        reminder("INC-1", ReminderKind.DEFAULT, BASE_TIME.plus(Duration.ofMinutes(2)));
    repository.install(newer);

    assertThat(repository.removeIfCurrent("INC-1", ReminderKind.DEFAULT, observed.token()))
        .isFalse();
    assertThat(repository.find("INC-1", ReminderKind.DEFAULT)).contains(newer);

    assertThat(repository.removeIfCurrent("INC-1", ReminderKind.DEFAULT, newer.token())).isTrue();
    assertThat(repository.countPending()).isZero();
  }

  private ReminderRecord reminder(String ticketKey, ReminderKind kind, Instant dueAt) {
    final IncidentRecord incident =
        IncidentRecord.created(ticketKey, "C1", "100.1", "U-AUTHOR", BASE_TIME);
    return new ReminderRecord(
        ticketKey,
        kind,
        UUID.randomUUID().toString(),
        dueAt,
        2,
        IncidentSnapshot.of(incident),
        BASE_TIME);
  }
}
