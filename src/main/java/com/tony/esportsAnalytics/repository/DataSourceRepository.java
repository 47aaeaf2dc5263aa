package com.tony.esportsAnalytics.repository;

import com.tony.esportsAnalytics.model.DataSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DataSourceRepository extends JpaRepository<DataSource, Long> {
    Optional<DataSource> findByName(String name);

    boolean existsByName(String name);
}
