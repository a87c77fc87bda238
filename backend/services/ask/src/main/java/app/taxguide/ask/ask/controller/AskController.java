package app.taxguide.ask.ask.controller;

import app.taxguide.ask.ask.dto.AskRequest;
import app.taxguide.ask.ask.dto.AskResponse;
import app.taxguide.ask.ask.service.AskService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/ask")
public class AskController {

    private final AskService askService;

    public AskController(AskService askService) {
        this.askService = askService;
    }

    // POST /ask
    @PostMapping
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        AskResponse response = askService.ask(request);
        if ("invalid_request".equals(response.error())) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }
}
