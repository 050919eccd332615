package io.github.drompincen.agentinbox.gateway.controller;

import io.github.drompincen.agentinbox.protocol.api.AgentDto;
import io.github.drompincen.agentinbox.runtime.agent.AgentCapabilities;
import io.github.drompincen.agentinbox.runtime.inbox.InboxService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final InboxService inboxService;

    public AgentController(InboxService inboxService) {
        this.inboxService = inboxService;
    }

    @GetMapping
    public List<AgentDto> list() {
        return inboxService.listAgents().stream().map(AgentCapabilities::toDto).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<AgentDto> get(@PathVariable String id) {
        return inboxService.listAgents().stream()
                .filter(a -> a.agentId().equals(id))
                .findFirst()
                .map(a -> ResponseEntity.ok(a.toDto()))
                .orElse(ResponseEntity.notFound().build());
    }
}
