package io.b2mash.timeledger.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.timeledger.config.LedgerProperties;
import io.b2mash.timeledger.exception.ForbiddenException;
import io.b2mash.timeledger.exception.InvalidStateException;
import io.b2mash.timeledger.ledger.LedgerStore;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LedgerUserServiceTest {

  @Mock private LedgerStore ledgerStore;

  @Test
  void login_trimsNameAndDelegatesToFindOrCreate() {
    var service = serviceAllowing(List.of());
    var alice = new LedgerUser("Alice", Instant.now());
    when(ledgerStore.findOrCreateUser("Alice")).thenReturn(alice);

    assertThat(service.login("  Alice ")).isSameAs(alice);
  }

  @Test
  void login_blankName_isRejected() {
    var service = serviceAllowing(List.of());

    assertThatThrownBy(() -> service.login("   ")).isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> service.login(null)).isInstanceOf(InvalidStateException.class);
    verifyNoInteractions(ledgerStore);
  }

  @Test
  void login_overlongName_isRejected() {
    var service = serviceAllowing(List.of());

    assertThatThrownBy(() -> service.login("x".repeat(256)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void login_withAllowList_acceptsListedNamesOnly() {
    var service = serviceAllowing(List.of("Noah", " Elena", "Timon"));
    var elena = new LedgerUser("Elena", Instant.now());
    when(ledgerStore.findOrCreateUser("Elena")).thenReturn(elena);

    assertThat(service.login("Elena")).isSameAs(elena);
    assertThatThrownBy(() -> service.login("Mallory")).isInstanceOf(ForbiddenException.class);
  }

  private LedgerUserService serviceAllowing(List<String> allowedUsers) {
    var properties =
        new LedgerProperties(ZoneId.of("Europe/Zurich"), 500, allowedUsers, Duration.ofSeconds(30));
    return new LedgerUserService(ledgerStore, properties);
  }
}
