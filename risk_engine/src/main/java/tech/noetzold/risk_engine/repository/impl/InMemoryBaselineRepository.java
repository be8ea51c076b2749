package tech.noetzold.risk_engine.repository.impl;

import org.springframework.stereotype.Repository;
import tech.noetzold.risk_engine.model.BaselineRecord;
import tech.noetzold.risk_engine.repository.BaselineRepository;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryBaselineRepository implements BaselineRepository {
    private final Map<String, BaselineRecord> db = new ConcurrentHashMap<>();

    @Override
    public Optional<BaselineRecord> findByPackageName(String packageName) {
        if (packageName == null || packageName.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(db.get(packageName));
    }

    @Override
    public BaselineRecord save(BaselineRecord record) {
        db.put(record.packageName(), record);
        return record;
    }

    @Override
    public Collection<BaselineRecord> findAll() {
        return List.copyOf(db.values());
    }

    @Override
    public long count() {
        return db.size();
    }
}
