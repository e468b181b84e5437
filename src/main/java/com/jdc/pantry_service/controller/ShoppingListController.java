package com.jdc.pantry_service.controller;

import com.jdc.pantry_service.domain.dto.shopping.RestockSuggestionDto;
import com.jdc.pantry_service.domain.dto.shopping.ShoppingItemResponseDto;
import com.jdc.pantry_service.service.ShoppingListService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;

@RestController
@RequestMapping("/api/me/shopping-list")
@RequiredArgsConstructor
@Tag(name = "장보기 목록 API", description = "요리 확정 시 추가된 부족분 목록을 조회, 체크, 삭제합니다.")
public class ShoppingListController {

    private final ShoppingListService shoppingListService;

    @GetMapping("/items")
    @Operation(summary = "장보기 목록 조회", description = "체크하지 않은 항목부터 최근 추가 순으로 조회합니다.")
    public ResponseEntity<List<ShoppingItemResponseDto>> getItems(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(shoppingListService.getItems(userId));
    }

    @PatchMapping("/items/{itemId}/toggle")
    @Operation(summary = "구매 체크 토글")
    public ResponseEntity<ShoppingItemResponseDto> toggle(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long itemId) {
        return ResponseEntity.ok(shoppingListService.toggle(userId, itemId));
    }

    @DeleteMapping("/items/{itemId}")
    @Operation(summary = "장보기 항목 삭제")
    public ResponseEntity<?> delete(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long itemId) {
        shoppingListService.delete(userId, itemId);
        return ResponseEntity.ok(Collections.emptyMap());
    }

    @GetMapping("/restock")
    @Operation(summary = "재구매 추천", description = "재고가 기준치 이하로 남은 항목을 적게 남은 순으로 추천합니다.")
    public ResponseEntity<List<RestockSuggestionDto>> suggestRestock(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(shoppingListService.suggestRestock(userId));
    }
}
