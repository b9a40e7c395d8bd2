package com.vedant.dataquery.dto;

public class MessageDTO {
    private String message;
    private String category;

    public MessageDTO() {}

    public MessageDTO(String message) {
        this.message = message;
    }

    public MessageDTO(String message, String category) {
        this.message = message;
        this.category = category;
    }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }

    public String getCategory() { return category; }
    public void setCategory(String category) { this.category = category; }
}
