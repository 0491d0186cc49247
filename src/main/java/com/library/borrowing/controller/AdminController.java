package com.library.borrowing.controller;

import com.library.borrowing.dto.request.CreateUserRequest;
import com.library.borrowing.dto.response.BorrowRequestResponse;
import com.library.borrowing.dto.response.HistoryEntryResponse;
import com.library.borrowing.dto.response.MessageResponse;
import com.library.borrowing.dto.response.UserCreatedResponse;
import com.library.borrowing.service.BorrowRequestService;
import com.library.borrowing.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Tag(name = "Administration", description = "User management and borrow request approval (admin only)")
public class AdminController {

    private final UserService userService;
    private final BorrowRequestService borrowRequestService;

    @PostMapping("/users")
    @Operation(summary = "Create a user", description = "Creates a regular (non-admin) account.")
    @ApiResponse(responseCode = "201", description = "User created")
    @ApiResponse(responseCode = "400", description = "Invalid email, short password, or email already in use")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    public ResponseEntity<UserCreatedResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(request));
    }

    @GetMapping("/requests")
    @Operation(summary = "List all borrow requests", description = "Pending and processed requests of every user, with book titles.")
    @ApiResponse(responseCode = "200", description = "Requests returned")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    public ResponseEntity<List<BorrowRequestResponse>> findAllRequests() {
        return ResponseEntity.ok(borrowRequestService.findAll());
    }

    @PostMapping("/requests/{id}")
    @Operation(summary = "Approve or deny a borrow request", description = "Approval requires a pending request "
        + "whose range does not overlap an approved one, and decrements the book's available copies. "
        + "Denial is applied regardless of the current status.")
    @ApiResponse(responseCode = "200", description = "Request processed")
    @ApiResponse(responseCode = "400", description = "Invalid action, already processed, or overlapping approved loan")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    @ApiResponse(responseCode = "404", description = "Request not found")
    public ResponseEntity<MessageResponse> process(
            @PathVariable Long id,
            @Parameter(description = "approve or deny", example = "approve") @RequestParam String action) {
        return ResponseEntity.ok(borrowRequestService.process(id, action));
    }

    @GetMapping("/users/{id}/history")
    @Operation(summary = "View a user's borrowing history")
    @ApiResponse(responseCode = "200", description = "History returned")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    @ApiResponse(responseCode = "404", description = "User not found")
    public ResponseEntity<List<HistoryEntryResponse>> userHistory(@PathVariable Long id) {
        return ResponseEntity.ok(borrowRequestService.findHistoryOfExistingUser(id));
    }
}
