package com.example.reme.model;

import java.util.ArrayList;
import java.util.List;

public class RecipeStep {
    public int step;
    public String instruction;
    public Integer duration;   // minutes, nullable
    public List<String> ingredientsUsed = new ArrayList<>();
    public List<String> appliancesUsed = new ArrayList<>(); // appliance ids or capability tags
    public String tip;
    public String warning;

    public RecipeStep() {}
    public RecipeStep(int step, String instruction) { this.step = step; this.instruction = instruction; }
}
