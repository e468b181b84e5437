package com.jdc.pantry_service.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- User (100) ---
    USER_ID_REQUIRED(HttpStatus.UNAUTHORIZED, "101", "A signed-in user is required."),

    // --- Inventory (400) ---
    INVALID_INVENTORY_REQUEST(HttpStatus.BAD_REQUEST, "401", "The inventory request is invalid."),
    INVALID_INGREDIENT_QUANTITY(HttpStatus.BAD_REQUEST, "402", "The ingredient quantity is invalid."),
    MISSING_INGREDIENT_NAME(HttpStatus.BAD_REQUEST, "403", "The ingredient name cannot be empty."),

    // --- Shopping list (500) ---
    SHOPPING_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "501", "The shopping list item does not exist."),

    // --- AI (700) ---
    AI_RECIPE_GENERATION_FAILED(HttpStatus.BAD_GATEWAY, "701", "Recipe generation failed."),
    AI_RESPONSE_INVALID(HttpStatus.BAD_GATEWAY, "702", "The recipe provider returned an invalid response."),
    INVALID_AI_RECIPE_REQUEST(HttpStatus.BAD_REQUEST, "703", "The recipe request is invalid."),
    UNSAFE_CONTENT(HttpStatus.BAD_REQUEST, "704",
            "We cannot generate this type of content. Please request a recipe with appropriate, edible ingredients."),
    RECIPE_REQUEST_TOO_LONG(HttpStatus.BAD_REQUEST, "705", "The request is too long. Please keep requests under 5000 characters."),

    // --- Assistant command (800) ---
    INVALID_ASSISTANT_COMMAND(HttpStatus.BAD_REQUEST, "801", "The assistant command is invalid."),
    UNRECOGNIZED_COMMAND(HttpStatus.BAD_REQUEST, "802", "I didn't understand that command."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "Invalid input value."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "The HTTP method is not allowed."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "Internal server error."),
    NULL_POINTER(HttpStatus.BAD_REQUEST, "904", "Required data is missing."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "905", "Unsupported Content-Type. Use application/json."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "906", "The data conflicts with an existing record."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
