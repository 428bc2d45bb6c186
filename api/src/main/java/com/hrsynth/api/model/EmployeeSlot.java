package com.hrsynth.api.model;

/**
 * Position of one employee in the hierarchy. {@code managerIndex} is -1 for the CEO only.
 */
public record EmployeeSlot(int index, int seniorityLevel, int managerIndex) {

  public static final int NO_MANAGER = -1;

  public boolean isCeo() {
    return managerIndex == NO_MANAGER;
  }

  public String employeeId() {
    return Employee.idFor(index);
  }

  public String managerId() {
    return isCeo() ? null : Employee.idFor(managerIndex);
  }
}
