package com.homework.web.dto;

import lombok.Data;

import java.util.List;

@Data
public class DeleteRequest {

    private List<String> codes;
}
