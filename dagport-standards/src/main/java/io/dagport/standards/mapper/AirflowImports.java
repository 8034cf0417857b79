package io.dagport.standards.mapper;

final class AirflowImports
{
    static final String DUMMY_OPERATOR = "from airflow.operators import dummy_operator";
    static final String BASH_OPERATOR = "from airflow.operators import bash_operator";
    static final String PYTHON_OPERATOR = "from airflow.operators import python_operator";
    static final String DAGRUN_OPERATOR = "from airflow.operators import dagrun_operator";
    static final String DATAPROC_OPERATOR = "from airflow.contrib.operators import dataproc_operator";

    private AirflowImports()
    { }
}
