package com.example.cvpipeline.repository;

import com.example.cvpipeline.model.RawRoleRecord;

import java.util.List;

/**
 * Storage collaborator yielding the raw per-role texts of one candidate, most recent first.
 */
public interface RoleRecordSource {

    List<RawRoleRecord> fetchAll();
}
