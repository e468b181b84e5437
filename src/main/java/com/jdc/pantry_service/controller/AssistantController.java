package com.jdc.pantry_service.controller;

import com.jdc.pantry_service.domain.dto.command.AssistantCommand;
import com.jdc.pantry_service.domain.dto.command.CommandResult;
import com.jdc.pantry_service.domain.dto.command.ConfirmCommand;
import com.jdc.pantry_service.domain.dto.command.GenerateRecipeCommand;
import com.jdc.pantry_service.domain.dto.command.VoiceCommandRequestDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeConfirmRequestDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeGenerateRequestDto;
import com.jdc.pantry_service.domain.dto.safety.SafetyCheckRequestDto;
import com.jdc.pantry_service.domain.dto.safety.SafetyCheckResponseDto;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.facade.CommandHandler;
import com.jdc.pantry_service.service.VoiceCommandParser;
import com.jdc.pantry_service.util.ContentSafetyFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/assistant")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "쇼핑 어시스턴트 API", description = "재고 추가/차감, 레시피 추천, 요리 확정(재고 정산)을 하나의 명령 흐름으로 처리합니다.")
public class AssistantController {

    private final CommandHandler commandHandler;
    private final VoiceCommandParser voiceCommandParser;
    private final ContentSafetyFilter safetyFilter;

    @PostMapping("/commands")
    @Operation(summary = "어시스턴트 명령 실행",
            description = "type 이 add / remove / generate-recipe / confirm-recipe 인 명령을 실행합니다.")
    public ResponseEntity<CommandResult> execute(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody AssistantCommand command) {
        return ResponseEntity.ok(commandHandler.handle(userId, command));
    }

    @PostMapping("/voice")
    @Operation(summary = "음성/채팅 명령 실행", description = "문장을 고정 규칙으로 해석한 뒤 명령으로 실행합니다.")
    public ResponseEntity<CommandResult> executeVoice(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid VoiceCommandRequestDto dto) {
        AssistantCommand command = voiceCommandParser.parse(dto.getText());
        log.debug("[음성명령] '{}' -> {}", dto.getText(), command);
        return ResponseEntity.ok(commandHandler.handle(userId, command));
    }

    @PostMapping("/recipes/generate")
    @Operation(summary = "레시피 추천", description = "재고와 요청 요리로 레시피를 생성합니다. STRICT 는 재고만, FLEXIBLE 은 기본 양념과 필수 재료를 허용합니다.")
    public ResponseEntity<CommandResult> generateRecipe(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid RecipeGenerateRequestDto dto) {
        return ResponseEntity.ok(commandHandler.handle(userId,
                new GenerateRecipeCommand(dto.getIntent(), dto.getServings(), dto.getMode())));
    }

    @PostMapping("/recipes/confirm")
    @Operation(summary = "요리 확정", description = "레시피 재료만큼 재고를 차감하고, 부족분은 장보기 목록에 추가합니다. 같은 레시피를 두 번 확정하지 마세요.")
    public ResponseEntity<CommandResult> confirmRecipe(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid RecipeConfirmRequestDto dto) {
        return ResponseEntity.ok(commandHandler.handle(userId, new ConfirmCommand(dto.getIngredients())));
    }

    @PostMapping("/safety/check")
    @Operation(summary = "문구 안전 검사", description = "요리 스타일 등 자유 입력이 허용되는 내용인지 확인합니다. 차단 사유는 알려주지 않습니다.")
    public ResponseEntity<SafetyCheckResponseDto> checkSafety(@RequestBody @Valid SafetyCheckRequestDto dto) {
        boolean safe = safetyFilter.isSafe(dto.getText());
        return ResponseEntity.ok(SafetyCheckResponseDto.builder()
                .safe(safe)
                .message(safe ? null : ErrorCode.UNSAFE_CONTENT.getMessage())
                .build());
    }
}
