package io.b2mash.timeledger.user;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface LedgerUserRepository extends JpaRepository<LedgerUser, UUID> {

  Optional<LedgerUser> findByName(String name);
}
