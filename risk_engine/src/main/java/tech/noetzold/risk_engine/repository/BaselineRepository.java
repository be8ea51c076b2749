package tech.noetzold.risk_engine.repository;

import tech.noetzold.risk_engine.model.BaselineRecord;

import java.util.Collection;
import java.util.Optional;

public interface BaselineRepository {
    Optional<BaselineRecord> findByPackageName(String packageName);

    BaselineRecord save(BaselineRecord record);

    Collection<BaselineRecord> findAll();

    long count();
}
