package me.golemcore.map.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Progress notification of a turn, addressed to the chat it belongs to.
 */
@Builder
public record RuntimeEvent(RuntimeEventType type,Instant timestamp,String sessionId,String channelType,String chatId,Map<String,Object>payload){}
