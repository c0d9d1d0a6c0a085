package com.pluginexec.starter.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 异步提交或任务未完成时的响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskAcceptedDTO {

    public static final String PENDING = "pending";

    private String taskId;

    private String status;

    private String location;

    public static TaskAcceptedDTO pending(String taskId) {
        return new TaskAcceptedDTO(taskId, PENDING, "/tasks/" + taskId);
    }
}
