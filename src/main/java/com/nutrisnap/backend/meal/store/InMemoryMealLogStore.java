package com.nutrisnap.backend.meal.store;

import com.nutrisnap.backend.meal.model.DailySummary;
import com.nutrisnap.backend.meal.model.MealRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local store. Lost on restart; swap in a database-backed {@link MealLogStore}
 * for anything beyond a single instance.
 */
@Component
public class InMemoryMealLogStore implements MealLogStore {

    private record DayKey(Long userId, LocalDate date) {}

    private static final Comparator<MealRecord> NEWEST_FIRST =
            Comparator.comparing(MealRecord::createdAtUtc).reversed();

    private final Map<DayKey, DailySummary> summaries = new ConcurrentHashMap<>();
    private final Map<DayKey, List<MealRecord>> meals = new ConcurrentHashMap<>();

    @Override
    public DailySummary save(MealRecord meal) {
        DayKey key = new DayKey(meal.userId(), meal.localDate());
        // compute 對同一個 key 是原子的：meal list 跟 summary 一起更新
        return summaries.compute(key, (k, cur) -> {
            meals.computeIfAbsent(k, x -> new CopyOnWriteArrayList<>()).add(meal);
            DailySummary base = cur == null ? DailySummary.empty(k.userId(), k.date()) : cur;
            return base.add(meal.totals());
        });
    }

    @Override
    public DailySummary dailySummary(Long userId, LocalDate date) {
        DailySummary s = summaries.get(new DayKey(userId, date));
        return s == null ? DailySummary.empty(userId, date) : s;
    }

    @Override
    public List<MealRecord> meals(Long userId, LocalDate date) {
        List<MealRecord> out = new ArrayList<>(meals.getOrDefault(new DayKey(userId, date), List.of()));
        // 同一個 createdAt：後存的排前面（先反轉再 stable sort）
        Collections.reverse(out);
        out.sort(NEWEST_FIRST);
        return List.copyOf(out);
    }
}
