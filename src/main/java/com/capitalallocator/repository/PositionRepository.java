package com.capitalallocator.repository;

import com.capitalallocator.domain.model.Position;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of positions, keyed by position id. Entities are copied on the way in and out.
 */
@Repository
public class PositionRepository {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    public void save(Position position) {
        positions.put(position.getId(), position.toBuilder().build());
    }

    public Optional<Position> findById(String id) {
        Position position = positions.get(id);
        return position == null ? Optional.empty() : Optional.of(position.toBuilder().build());
    }

    public List<Position> findByAccount(String accountId) {
        return positions.values().stream()
                .filter(p -> accountId.equals(p.getAccountId()))
                .map(p -> p.toBuilder().build())
                .sorted(Comparator.comparing(Position::getId))
                .toList();
    }

    public List<Position> findOpenByAccount(String accountId) {
        return findByAccount(accountId).stream().filter(Position::isOpen).toList();
    }

    public void deleteAll() {
        positions.clear();
    }
}
