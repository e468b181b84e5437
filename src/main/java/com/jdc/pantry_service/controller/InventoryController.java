package com.jdc.pantry_service.controller;

import com.jdc.pantry_service.domain.dto.command.CommandResult;
import com.jdc.pantry_service.domain.dto.inventory.InventoryEntryDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryItemRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryTextRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.LedgerResult;
import com.jdc.pantry_service.facade.InventoryFacade;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/me/inventory")
@RequiredArgsConstructor
@Tag(name = "재고 API", description = "내 주방 재고를 조회, 추가, 차감, 수량 지정하는 기능을 제공합니다.")
public class InventoryController {

    private final InventoryFacade inventoryFacade;

    @GetMapping("/items")
    @Operation(summary = "내 재고 조회", description = "현재 보유 중인 재고를 이름순으로 조회합니다.")
    public ResponseEntity<List<InventoryEntryDto>> getMyItems(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId) {
        return ResponseEntity.ok(inventoryFacade.getItems(userId));
    }

    @PostMapping("/items")
    @Operation(summary = "재고 추가", description = "이름이 비슷한 재고가 있으면 단위를 환산해서 합치고, 없으면 새로 만듭니다.")
    public ResponseEntity<CommandResult> addItem(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid InventoryItemRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryFacade.addItem(userId, dto));
    }

    @PostMapping("/items/text")
    @Operation(summary = "자유 입력으로 재고 추가", description = "\"2 kg tomatoes\" 같은 문장을 해석해서 재고에 추가합니다.")
    public ResponseEntity<CommandResult> addItemFromText(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid InventoryTextRequestDto dto) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryFacade.addItemFromText(userId, dto.getText()));
    }

    @PutMapping("/items")
    @Operation(summary = "재고 수량 지정", description = "재고 수량을 지정한 값으로 바꿉니다. 0 이면 삭제합니다.")
    public ResponseEntity<LedgerResult> setQuantity(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestBody @Valid InventoryItemRequestDto dto) {
        return ResponseEntity.ok(inventoryFacade.setQuantity(userId, dto));
    }

    @DeleteMapping("/items")
    @Operation(summary = "재고 차감/삭제", description = "수량을 주면 그만큼 차감하고, 없으면 항목을 삭제합니다. 없는 항목은 success=false 로 응답합니다.")
    public ResponseEntity<CommandResult> removeItem(
            @Parameter(hidden = true) @RequestHeader("X-User-Id") Long userId,
            @RequestParam String name,
            @RequestParam(required = false) Double quantity,
            @RequestParam(required = false) String unit) {
        return ResponseEntity.ok(inventoryFacade.removeItem(userId, name, quantity, unit));
    }
}
