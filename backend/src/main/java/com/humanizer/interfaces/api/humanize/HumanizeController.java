package com.humanizer.interfaces.api.humanize;

import com.humanizer.application.humanize.HumanizeAppService;
import com.humanizer.domain.rewrite.model.HumanizeResult;
import com.humanizer.interfaces.api.dto.HumanizeRequest;
import com.humanizer.interfaces.api.dto.HumanizeResponse;
import com.humanizer.interfaces.api.dto.StyleProfileResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/humanize")
@RequiredArgsConstructor
public class HumanizeController {

    private final HumanizeAppService humanizeAppService;

    @PostMapping
    public ResponseEntity<HumanizeResponse> humanize(@Valid @RequestBody HumanizeRequest request) {
        HumanizeResult result = humanizeAppService.humanize(
                request.text(),
                request.style(),
                request.toOverrides());

        return ResponseEntity.ok(HumanizeResponse.from(result));
    }

    @GetMapping("/styles")
    public ResponseEntity<List<StyleProfileResponse>> styles() {
        List<StyleProfileResponse> styles = humanizeAppService.styles().entrySet().stream()
                .map(entry -> StyleProfileResponse.of(entry.getKey(), entry.getValue()))
                .toList();
        return ResponseEntity.ok(styles);
    }
}
