package com.riansoft.tsp_arena.service;

import com.riansoft.tsp_arena.config.ArenaProperties;
import com.riansoft.tsp_arena.exception.ConfigurationException;
import com.riansoft.tsp_arena.exception.SessionNotFoundException;
import com.riansoft.tsp_arena.model.City;
import com.riansoft.tsp_arena.model.DistanceModel;
import com.riansoft.tsp_arena.model.GameSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 세션 ID → 인스턴스 저장소. 세션은 한 번 쓰고 여러 번 읽습니다.
 * 모든 접근은 하나의 모니터로 직렬화되며, {@link #create}가 반환되기 전에 세션이 이미 조회 가능합니다.
 * 상한을 넘으면 가장 오래된 세션부터 제거합니다.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final int maxSessions;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, GameSession> sessions = new LinkedHashMap<>();

    @Autowired
    public SessionStore(ArenaProperties properties) {
        this(properties.getMaxSessions());
    }

    public SessionStore(int maxSessions) {
        if (maxSessions < 1) {
            throw new ConfigurationException("Session limit must be at least 1, got " + maxSessions + ".");
        }
        this.maxSessions = maxSessions;
    }

    /**
     * 세션을 저장하고 저장한 객체를 그대로 돌려줍니다.
     * 반환 직후 다른 요청의 생성으로 제거될 수 있으므로 호출자는 다시 조회하지 말고 이 객체를 사용합니다.
     */
    public GameSession create(DistanceModel model, City homeCity, List<City> cities) {
        String id = Long.toString(sequence.incrementAndGet());
        GameSession session = new GameSession(id, model, homeCity, cities, Instant.now());
        synchronized (sessions) {
            sessions.put(id, session);
            Iterator<GameSession> oldest = sessions.values().iterator();
            while (sessions.size() > maxSessions) {
                GameSession evicted = oldest.next();
                oldest.remove();
                log.info("[SESSION] 보관 한도({}) 초과로 세션 #{} 제거", maxSessions, evicted.id);
            }
        }
        return session;
    }

    public GameSession get(String sessionId) {
        GameSession session;
        synchronized (sessions) {
            session = sessions.get(sessionId);
        }
        if (session == null) {
            throw new SessionNotFoundException("Session '" + sessionId + "' not found. Start a new game.");
        }
        return session;
    }

    public int size() {
        synchronized (sessions) {
            return sessions.size();
        }
    }
}
