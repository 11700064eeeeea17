package com.nosota.tripfund.repository;

import com.nosota.tripfund.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, String> {

    List<AppUser> findByIdIn(Collection<String> ids);
}
