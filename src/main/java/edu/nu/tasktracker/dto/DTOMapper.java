package edu.nu.tasktracker.dto;

import edu.nu.tasktracker.model.AppUser;
import edu.nu.tasktracker.model.Task;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Entity to response conversion, shared by the controllers and services.
 */
public class DTOMapper {

    /**
     * Public user view; drops the password hash.
     */
    public static UserResponseDTO toUserDTO(AppUser user) {
        if (user == null) {
            return null;
        }
        return UserResponseDTO.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }

    public static TaskResponseDTO toTaskDTO(Task task) {
        if (task == null) {
            return null;
        }
        return TaskResponseDTO.builder()
                .id(task.getId())
                .title(task.getTitle())
                .description(task.getDescription())
                .completed(task.isCompleted())
                .ownerId(task.getOwnerId())
                .createdAt(task.getCreatedAt())
                .updatedAt(task.getUpdatedAt())
                .build();
    }

    public static List<TaskResponseDTO> toTaskDTOList(List<Task> tasks) {
        if (tasks == null) {
            return null;
        }
        return tasks.stream()
                .map(DTOMapper::toTaskDTO)
                .collect(Collectors.toList());
    }

    public static AuthResponse toAuthResponse(AppUser user, TokenPair tokens) {
        return AuthResponse.builder()
                .user(toUserDTO(user))
                .access(tokens.getAccessToken())
                .refresh(tokens.getRefreshToken())
                .build();
    }
}
