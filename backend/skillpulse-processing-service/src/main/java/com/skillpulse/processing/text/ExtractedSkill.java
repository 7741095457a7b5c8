package com.skillpulse.processing.text;

public record ExtractedSkill(String skill, String category) {}
