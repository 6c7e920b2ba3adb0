package com.example.triangle.broadcast;

import com.example.triangle.event.ChatMessageEvent;
import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayEnvelope implements Serializable {

    private String originId;
    private String channelName;
    private ChatMessageEvent event;
}
