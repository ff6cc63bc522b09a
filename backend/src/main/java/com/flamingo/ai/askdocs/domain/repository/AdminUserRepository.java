package com.flamingo.ai.askdocs.domain.repository;

import com.flamingo.ai.askdocs.domain.entity.AdminUser;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for AdminUser entities. */
@Repository
public interface AdminUserRepository extends JpaRepository<AdminUser, String> {

  List<AdminUser> findAllByOrderByUsernameAsc();
}
