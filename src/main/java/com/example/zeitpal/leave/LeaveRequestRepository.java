package com.example.zeitpal.leave;

import com.example.zeitpal.employee.Employee;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface LeaveRequestRepository extends JpaRepository<LeaveRequest, Long> {

    List<LeaveRequest> findByEmployeeOrderByStartDateDesc(Employee employee);

    List<LeaveRequest> findByStatusOrderByStartDateAsc(LeaveRequest.Status status);

    List<LeaveRequest> findByEmployeeAndStatusInOrderByStartDateAsc(Employee employee,
                                                                     Collection<LeaveRequest.Status> statuses);
}
